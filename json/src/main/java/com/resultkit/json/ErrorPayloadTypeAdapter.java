package com.resultkit.json;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.resultkit.common.result.ErrorPayload;
import java.io.IOException;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Reads and writes {@link ErrorPayload} in the flat wire shape {@code {"type": ..., ...fields,
 * "cause": ...}}.
 *
 * <p>Field values are written by their runtime type and read back as untyped JSON values. A {@code
 * cause} that is itself in the conventional shape (an object with a string {@code type}) is read
 * back as an {@code ErrorPayload}, so a whole cause chain survives the trip. A field whose JSON
 * value is {@code null} is dropped, as payloads hold no null fields.
 */
public final class ErrorPayloadTypeAdapter extends TypeAdapter<ErrorPayload> {

  /** Creates this adapter for {@code ErrorPayload}. */
  public static final TypeAdapterFactory FACTORY =
      new TypeAdapterFactory() {
        @Override
        @SuppressWarnings("unchecked")
        public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
          if (type.getRawType() != ErrorPayload.class) {
            return null;
          }
          return (TypeAdapter<T>) new ErrorPayloadTypeAdapter(gson);
        }
      };

  private final Gson gson;
  private final TypeAdapter<Object> objectAdapter;
  private final TypeAdapter<JsonElement> elementAdapter;

  ErrorPayloadTypeAdapter(Gson gson) {
    this.gson = gson;
    this.objectAdapter = gson.getAdapter(Object.class);
    this.elementAdapter = gson.getAdapter(JsonElement.class);
  }

  /** Returns true if {@code element} is an object with a non-empty string {@code type} member. */
  static boolean isConventional(JsonElement element) {
    if (!element.isJsonObject()) {
      return false;
    }
    JsonElement type = element.getAsJsonObject().get(ErrorPayload.TYPE_KEY);
    return type != null
        && type.isJsonPrimitive()
        && type.getAsJsonPrimitive().isString()
        && !type.getAsString().isEmpty();
  }

  @Override
  public void write(JsonWriter out, ErrorPayload payload) throws IOException {
    if (payload == null) {
      out.nullValue();
      return;
    }
    out.beginObject();
    out.name(ErrorPayload.TYPE_KEY).value(payload.type());
    for (Map.Entry<String, Object> field : payload.fields().entrySet()) {
      out.name(field.getKey());
      objectAdapter.write(out, field.getValue());
    }
    if (payload.cause().isPresent()) {
      out.name(ErrorPayload.CAUSE_KEY);
      objectAdapter.write(out, payload.cause().get());
    }
    out.endObject();
  }

  @Override
  public ErrorPayload read(JsonReader in) throws IOException {
    if (in.peek() == JsonToken.NULL) {
      in.nextNull();
      return null;
    }
    return fromTree(elementAdapter.read(in));
  }

  /**
   * Reads an error of unknown type: a conventional object becomes an {@code ErrorPayload}, anything
   * else becomes a plain JSON value.
   */
  Object readError(JsonElement element) {
    return isConventional(element) ? fromTree(element) : gson.fromJson(element, Object.class);
  }

  private ErrorPayload fromTree(JsonElement element) {
    if (!isConventional(element)) {
      Logger.warn("Rejecting error payload without a string 'type': {}", element);
      throw new JsonParseException(
          "Error payload must be an object with a string 'type': " + element);
    }
    JsonObject object = element.getAsJsonObject();
    ErrorPayload.Builder builder =
        ErrorPayload.builder(object.get(ErrorPayload.TYPE_KEY).getAsString());
    for (Map.Entry<String, JsonElement> member : object.entrySet()) {
      String key = member.getKey();
      JsonElement value = member.getValue();
      if (ErrorPayload.TYPE_KEY.equals(key) || value.isJsonNull()) {
        continue;
      }
      if (ErrorPayload.CAUSE_KEY.equals(key)) {
        builder.cause(readError(value));
      } else {
        builder.put(key, gson.fromJson(value, Object.class));
      }
    }
    return builder.build();
  }
}
