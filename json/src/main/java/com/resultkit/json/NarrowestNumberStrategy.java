package com.resultkit.json;

import com.google.gson.JsonParseException;
import com.google.gson.ToNumberStrategy;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.MalformedJsonException;
import java.io.IOException;

/**
 * Reads JSON numbers in untyped positions as the narrowest of {@code Integer}, {@code Long} and
 * {@code Double} that holds them exactly.
 *
 * <p>Error context is usually built from {@code int} literals ({@code Map.of("id", 2)}); reading
 * {@code 2} back as an {@code Integer} keeps such payloads equal across a round trip.
 */
public enum NarrowestNumberStrategy implements ToNumberStrategy {
  INSTANCE;

  @Override
  public Number readNumber(JsonReader in) throws IOException {
    String text = in.nextString();
    try {
      long value = Long.parseLong(text);
      if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
        return (int) value;
      }
      return value;
    } catch (NumberFormatException notIntegral) {
      return parseDouble(text, in);
    }
  }

  private static Double parseDouble(String text, JsonReader in) throws IOException {
    try {
      Double value = Double.valueOf(text);
      if ((value.isInfinite() || value.isNaN()) && !in.isLenient()) {
        throw new MalformedJsonException(
            "JSON forbids NaN and infinities: " + value + "; at path " + in.getPath());
      }
      return value;
    } catch (NumberFormatException e) {
      throw new JsonParseException("Cannot parse " + text + "; at path " + in.getPath(), e);
    }
  }
}
