package com.resultkit.json;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.resultkit.common.result.Result;
import com.resultkit.common.result.ResultRecord;
import java.util.Map;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * JSON codec for results.
 *
 * <p>A result is written as {@code {"ok": true, "value": ...}} or {@code {"ok": false, "error":
 * ...}}. Reading it back with the same declared types reproduces an equal result:
 *
 * <pre>{@code
 * ResultJson json = ResultJson.create();
 * String text = json.toJson(Results.err("Timeout", Map.of("ms", 1000)));
 * Result<Integer, ErrorPayload> back =
 *     json.fromJson(text, new TypeToken<Result<Integer, ErrorPayload>>() {});
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class ResultJson {

  /**
   * Codec options.
   *
   * @param prettyPrinting whether output is indented
   * @param encodeCapturedExceptions whether exceptions held as errors are written in the
   *     conventional error shape; when false they are written as a {@code "<type>: <message>"}
   *     string
   */
  public record Config(boolean prettyPrinting, boolean encodeCapturedExceptions) {

    /** Compact output; captured exceptions encoded. */
    public static Config defaults() {
      return new Config(false, true);
    }
  }

  private static final TypeToken<Result<Object, Object>> UNTYPED_RESULT =
      new TypeToken<Result<Object, Object>>() {};

  private static final TypeToken<Map<String, Object>> RECORD_MAP =
      new TypeToken<Map<String, Object>>() {};

  private final Gson gson;
  private final Config config;

  private ResultJson(Gson gson, Config config) {
    this.gson = gson;
    this.config = config;
  }

  /** Creates a codec with {@link Config#defaults()}. */
  public static ResultJson create() {
    return create(Config.defaults());
  }

  public static ResultJson create(@Nonnull Config config) {
    checkNotNull(config, "config");
    GsonBuilder builder = register(new GsonBuilder(), config);
    if (config.prettyPrinting()) {
      builder.setPrettyPrinting();
    }
    Logger.debug("Created result codec with {}", config);
    return new ResultJson(builder.create(), config);
  }

  /**
   * Installs result support into a caller-owned builder, with default options.
   *
   * @return {@code builder}
   */
  public static GsonBuilder register(@Nonnull GsonBuilder builder) {
    return register(builder, Config.defaults());
  }

  /**
   * Installs result support into a caller-owned builder. Untyped JSON numbers read through the
   * builder's {@code Gson} become the narrowest fitting integral type, see {@link
   * NarrowestNumberStrategy}. Pretty printing is left to the caller.
   *
   * @return {@code builder}
   */
  public static GsonBuilder register(@Nonnull GsonBuilder builder, @Nonnull Config config) {
    checkNotNull(builder, "builder");
    checkNotNull(config, "config");
    builder
        .registerTypeAdapterFactory(new ResultTypeAdapterFactory())
        .registerTypeAdapterFactory(ErrorPayloadTypeAdapter.FACTORY)
        .setObjectToNumberStrategy(NarrowestNumberStrategy.INSTANCE);
    builder.registerTypeAdapterFactory(
        config.encodeCapturedExceptions()
            ? ThrowableTypeAdapter.FACTORY
            : ThrowableTypeAdapter.SUMMARY_FACTORY);
    return builder;
  }

  /** Writes {@code result} using the runtime types of its value and error. */
  public String toJson(@Nonnull Result<?, ?> result) {
    return gson.toJson(checkNotNull(result, "result"));
  }

  /** Writes {@code result} using the adapters for the declared {@code type}. */
  public <V, E> String toJson(
      @Nonnull Result<V, E> result, @Nonnull TypeToken<? extends Result<V, E>> type) {
    return gson.toJson(checkNotNull(result, "result"), type.getType());
  }

  /**
   * Reads a result whose value and error have the declared types.
   *
   * @throws JsonParseException if {@code json} is not a well-formed result
   */
  public <V, E> Result<V, E> fromJson(
      @Nonnull String json, @Nonnull TypeToken<Result<V, E>> type) {
    Result<V, E> result = gson.fromJson(checkNotNull(json, "json"), type);
    if (result == null) {
      Logger.warn("Rejecting empty result input: '{}'", json);
      throw new JsonParseException("Expected a result, got: '" + json + "'");
    }
    return result;
  }

  /**
   * Reads a result without declared types. Values come back as plain JSON values; a conventional
   * error comes back as an {@link com.resultkit.common.result.ErrorPayload}.
   */
  public Result<Object, Object> fromJson(@Nonnull String json) {
    return fromJson(json, UNTYPED_RESULT);
  }

  /**
   * Reads only the plain record, with maps and lists for nested objects. Pass it to {@link
   * com.resultkit.common.result.Results#result(ResultRecord)} to get a live result back.
   *
   * @throws JsonParseException if {@code json} is not an object with a boolean {@code ok}
   */
  public ResultRecord<Object, Object> toRecord(@Nonnull String json) {
    Map<String, Object> map = gson.fromJson(checkNotNull(json, "json"), RECORD_MAP);
    if (map == null) {
      Logger.warn("Rejecting empty result record input: '{}'", json);
      throw new JsonParseException("Expected a result record, got: '" + json + "'");
    }
    try {
      return ResultRecord.fromMap(map);
    } catch (IllegalArgumentException e) {
      Logger.warn("Rejecting result record without a boolean 'ok': {}", json);
      throw new JsonParseException(e.getMessage(), e);
    }
  }

  /** The underlying {@code Gson}, for coding results nested in other objects. */
  public Gson gson() {
    return gson;
  }

  public Config config() {
    return config;
  }
}
