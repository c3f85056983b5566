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
import com.resultkit.common.result.Result;
import com.resultkit.common.result.ResultRecord;
import java.io.IOException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import org.tinylog.Logger;

/**
 * Gson support for {@link Result} and its two variants, in the wire shape {@code {"ok": true,
 * "value": ...}} or {@code {"ok": false, "error": ...}}.
 *
 * <p>The value and error are coded with the adapters for the declared type arguments. A raw or
 * unresolved type argument is treated as {@code Object}; an {@code Object} error that is in the
 * conventional error shape is read back as an {@link com.resultkit.common.result.ErrorPayload}.
 */
public final class ResultTypeAdapterFactory implements TypeAdapterFactory {

  @Override
  @SuppressWarnings("unchecked")
  public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
    Class<? super T> rawType = type.getRawType();
    if (!Result.class.isAssignableFrom(rawType)) {
      return null;
    }
    Type valueType = typeArgument(type.getType(), 0);
    Type errorType = typeArgument(type.getType(), 1);

    TypeAdapter<Object> valueAdapter =
        (TypeAdapter<Object>) gson.getAdapter(TypeToken.get(valueType));
    TypeAdapter<Object> errorAdapter =
        errorType == Object.class
            ? new ConventionalErrorAdapter(gson)
            : (TypeAdapter<Object>) gson.getAdapter(TypeToken.get(errorType));
    return (TypeAdapter<T>)
        new ResultAdapter(rawType, valueAdapter, errorAdapter, gson.getAdapter(JsonElement.class));
  }

  private static Type typeArgument(Type type, int index) {
    if (!(type instanceof ParameterizedType)) {
      return Object.class;
    }
    Type argument = ((ParameterizedType) type).getActualTypeArguments()[index];
    if (argument instanceof WildcardType) {
      argument = ((WildcardType) argument).getUpperBounds()[0];
    }
    return argument instanceof Class || argument instanceof ParameterizedType
        ? argument
        : Object.class;
  }

  private static JsonParseException malformed(String reason, JsonElement element) {
    Logger.warn("Rejecting malformed result ({}): {}", reason, element);
    return new JsonParseException("Malformed result, " + reason + ": " + element);
  }

  private static boolean isPresent(JsonElement element) {
    return element != null && !element.isJsonNull();
  }

  /** Writes through the runtime type; reads conventional objects back as payloads. */
  private static final class ConventionalErrorAdapter extends TypeAdapter<Object> {
    private final TypeAdapter<Object> objectAdapter;
    private final TypeAdapter<JsonElement> elementAdapter;
    private final ErrorPayloadTypeAdapter payloadAdapter;

    ConventionalErrorAdapter(Gson gson) {
      this.objectAdapter = gson.getAdapter(Object.class);
      this.elementAdapter = gson.getAdapter(JsonElement.class);
      this.payloadAdapter = new ErrorPayloadTypeAdapter(gson);
    }

    @Override
    public void write(JsonWriter out, Object error) throws IOException {
      objectAdapter.write(out, error);
    }

    @Override
    public Object read(JsonReader in) throws IOException {
      return payloadAdapter.readError(elementAdapter.read(in));
    }
  }

  private static final class ResultAdapter extends TypeAdapter<Result<Object, Object>> {
    private final Class<?> rawType;
    private final TypeAdapter<Object> valueAdapter;
    private final TypeAdapter<Object> errorAdapter;
    private final TypeAdapter<JsonElement> elementAdapter;

    ResultAdapter(
        Class<?> rawType,
        TypeAdapter<Object> valueAdapter,
        TypeAdapter<Object> errorAdapter,
        TypeAdapter<JsonElement> elementAdapter) {
      this.rawType = rawType;
      this.valueAdapter = valueAdapter;
      this.errorAdapter = errorAdapter;
      this.elementAdapter = elementAdapter;
    }

    @Override
    public void write(JsonWriter out, Result<Object, Object> result) throws IOException {
      if (result == null) {
        out.nullValue();
        return;
      }
      out.beginObject();
      out.name(ResultRecord.OK_KEY).value(result.isOk());
      if (result.isOk()) {
        out.name(ResultRecord.VALUE_KEY);
        writeValue(out, result.getValue());
      } else {
        out.name(ResultRecord.ERROR_KEY);
        errorAdapter.write(out, result.getError());
      }
      out.endObject();
    }

    // A success always carries its value member, even when the value is null.
    private void writeValue(JsonWriter out, Object value) throws IOException {
      if (value != null) {
        valueAdapter.write(out, value);
        return;
      }
      boolean serializeNulls = out.getSerializeNulls();
      out.setSerializeNulls(true);
      try {
        out.nullValue();
      } finally {
        out.setSerializeNulls(serializeNulls);
      }
    }

    @Override
    public Result<Object, Object> read(JsonReader in) throws IOException {
      if (in.peek() == JsonToken.NULL) {
        in.nextNull();
        return null;
      }
      JsonElement element = elementAdapter.read(in);
      if (!element.isJsonObject()) {
        throw malformed("expected an object", element);
      }
      JsonObject object = element.getAsJsonObject();
      JsonElement ok = object.get(ResultRecord.OK_KEY);
      if (ok == null || !ok.isJsonPrimitive() || !ok.getAsJsonPrimitive().isBoolean()) {
        throw malformed("'ok' must be a boolean", element);
      }
      JsonElement value = object.get(ResultRecord.VALUE_KEY);
      JsonElement error = object.get(ResultRecord.ERROR_KEY);

      Result<Object, Object> result;
      if (ok.getAsBoolean()) {
        if (isPresent(error)) {
          throw malformed("a success has no error", element);
        }
        result = Result.ok(isPresent(value) ? valueAdapter.fromJsonTree(value) : null);
      } else {
        if (!isPresent(error)) {
          throw malformed("a failure needs an error", element);
        }
        if (isPresent(value)) {
          throw malformed("a failure has no value", element);
        }
        Object decoded = errorAdapter.fromJsonTree(error);
        if (decoded == null) {
          throw malformed("a failure needs an error", element);
        }
        result = Result.err(decoded);
      }

      if (!rawType.isInstance(result)) {
        throw malformed("expected " + rawType.getSimpleName(), element);
      }
      return result;
    }
  }
}
