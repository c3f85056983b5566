package com.resultkit.common.result;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The plain shape of a {@link Result} with no behavior attached: {@code {ok: true, value}} or
 * {@code {ok: false, error}}.
 *
 * <p>This is what a result looks like after it has been persisted or sent somewhere and read back
 * by code that knows nothing about {@code Result}. {@link Results#result(ResultRecord)} turns it
 * back into a live result.
 *
 * @param ok the discriminant
 * @param value the value of a success, null for a failure
 * @param error the error of a failure, null for a success
 * @param <V> the value type
 * @param <E> the error type
 */
public record ResultRecord<V, E>(boolean ok, @Nullable V value, @Nullable E error) {

  /** Key of the discriminant in the map form. */
  public static final String OK_KEY = "ok";

  /** Key of the success value in the map form. */
  public static final String VALUE_KEY = "value";

  /** Key of the failure error in the map form. */
  public static final String ERROR_KEY = "error";

  /** The record of a success. */
  public static <V, E> ResultRecord<V, E> ok(@Nullable V value) {
    return new ResultRecord<>(true, value, null);
  }

  /** The record of a failure. */
  public static <V, E> ResultRecord<V, E> err(@Nullable E error) {
    return new ResultRecord<>(false, null, error);
  }

  /**
   * Reads a record out of a generic map with an {@code ok} entry, such as one produced by a JSON
   * parser.
   *
   * @throws IllegalArgumentException if the map has no boolean {@code ok} entry
   */
  @SuppressWarnings("unchecked")
  public static <V, E> ResultRecord<V, E> fromMap(@Nonnull Map<String, ?> map) {
    Object ok = map.get(OK_KEY);
    checkArgument(ok instanceof Boolean, "Result record must have a boolean '%s' entry: %s",
        OK_KEY, map);
    return new ResultRecord<>((Boolean) ok, (V) map.get(VALUE_KEY), (E) map.get(ERROR_KEY));
  }

  /**
   * Returns true when the populated side agrees with the discriminant: a success has no error, and
   * a failure has an error and no value.
   */
  public boolean isWellFormed() {
    return ok ? error == null : error != null && value == null;
  }
}
