package com.resultkit.json;

import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import com.resultkit.common.result.ErrorPayload;
import java.io.IOException;
import java.util.List;

/**
 * Writes a captured exception in the conventional error shape: {@code {"type": <simple class
 * name>, "message": ..., "cause": {...}}}, one nested object per link of the causal chain.
 *
 * <p>With {@link #SUMMARY_FACTORY} the exception is instead written as a single string, {@code
 * "<simple class name>: <message>"}, the form used when captured exceptions are not encoded as
 * error payloads.
 *
 * <p>The encoding is one-way. Declare the error slot as {@code Object} or {@link ErrorPayload} to
 * read it back; reading into a {@code Throwable} slot is rejected.
 */
public final class ThrowableTypeAdapter extends TypeAdapter<Throwable> {

  static final String MESSAGE_KEY = "message";

  /** Writes {@code Throwable} and all of its subclasses in the conventional error shape. */
  public static final TypeAdapterFactory FACTORY = factory(true);

  /** Writes {@code Throwable} and all of its subclasses as a one-line summary string. */
  public static final TypeAdapterFactory SUMMARY_FACTORY = factory(false);

  private final boolean structured;

  ThrowableTypeAdapter(boolean structured) {
    this.structured = structured;
  }

  private static TypeAdapterFactory factory(boolean structured) {
    return new TypeAdapterFactory() {
      @Override
      @SuppressWarnings("unchecked")
      public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!Throwable.class.isAssignableFrom(type.getRawType())) {
          return null;
        }
        return (TypeAdapter<T>) new ThrowableTypeAdapter(structured);
      }
    };
  }

  /** Returns the discriminant a captured exception is written under. */
  static String typeOf(Throwable throwable) {
    String simpleName = throwable.getClass().getSimpleName();
    return Strings.isNullOrEmpty(simpleName) ? throwable.getClass().getName() : simpleName;
  }

  /** Returns {@code "<type>: <message>"}, or just the type when there is no message. */
  static String summaryOf(Throwable throwable) {
    String message = throwable.getMessage();
    return message == null ? typeOf(throwable) : typeOf(throwable) + ": " + message;
  }

  @Override
  public void write(JsonWriter out, Throwable throwable) throws IOException {
    if (throwable == null) {
      out.nullValue();
      return;
    }
    if (!structured) {
      out.value(summaryOf(throwable));
      return;
    }
    List<Throwable> chain = Throwables.getCausalChain(throwable);
    for (Throwable link : chain) {
      out.beginObject();
      out.name(ErrorPayload.TYPE_KEY).value(typeOf(link));
      if (link.getMessage() != null) {
        out.name(MESSAGE_KEY).value(link.getMessage());
      }
      if (link.getCause() != null) {
        out.name(ErrorPayload.CAUSE_KEY);
      }
    }
    for (int i = 0; i < chain.size(); i++) {
      out.endObject();
    }
  }

  @Override
  public Throwable read(JsonReader in) throws IOException {
    throw new JsonParseException(
        "Captured exceptions are not read back as Throwable; declare the error as Object or"
            + " ErrorPayload at path " + in.getPath());
  }
}
