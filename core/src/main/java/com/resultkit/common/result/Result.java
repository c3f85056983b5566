package com.resultkit.common.result;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Iterators;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The outcome of an operation that can fail, held as a value: either an {@link Ok} carrying the
 * operation's value or an {@link Err} carrying its error.
 *
 * <p>{@link #isOk()} is the discriminant. A success never has an error and a failure always has
 * one; reading the side that is absent throws {@link IllegalStateException}. Results are immutable.
 * Combinators return a new result, or this same instance when the branch does nothing.
 *
 * <p>A result is also a sequence of zero or one values: iterating a success yields its value once,
 * iterating a failure yields nothing.
 *
 * @param <V> the type of the value in case of success
 * @param <E> the type of the error in case of failure
 */
public abstract class Result<V, E> implements Iterable<V> {

  private Result() {}

  /** Creates a success carrying {@code value}, which may be null. */
  public static <V, E> Result<V, E> ok(@Nullable V value) {
    return new Ok<>(value);
  }

  /** Creates a success that carries no value. */
  public static <V, E> Result<V, E> ok() {
    return new Ok<>(null);
  }

  /**
   * Creates a failure carrying {@code error}.
   *
   * @throws NullPointerException if error is null
   */
  public static <V, E> Result<V, E> err(@Nonnull E error) {
    return new Err<>(checkNotNull(error, "A failure must carry an error"));
  }

  /** Returns true for a success, false for a failure. */
  public abstract boolean isOk();

  /** Returns true for a failure. */
  public final boolean isErr() {
    return !isOk();
  }

  /**
   * Returns the value of a success.
   *
   * @throws IllegalStateException if this is a failure
   */
  @Nullable
  public abstract V getValue();

  /**
   * Returns the error of a failure.
   *
   * @throws IllegalStateException if this is a success
   */
  @Nonnull
  public abstract E getError();

  /**
   * Applies {@code mapper} to the value of a success. A failure is returned unchanged and the
   * mapper is not called.
   */
  @Nonnull
  public abstract <U> Result<U, E> map(@Nonnull Function<? super V, ? extends U> mapper);

  /**
   * Applies {@code mapper} to the error of a failure. A success is returned unchanged and the
   * mapper is not called.
   */
  @Nonnull
  public abstract <F> Result<V, F> mapErr(@Nonnull Function<? super E, ? extends F> mapper);

  /**
   * Returns the result of applying {@code mapper} to the value of a success, which chains a
   * further fallible step without nesting. A failure short-circuits: it is returned unchanged and
   * the mapper is not called.
   */
  @Nonnull
  public abstract <U> Result<U, E> flatMap(@Nonnull Function<? super V, Result<U, E>> mapper);

  /**
   * Returns the value of a success, or raises the error of a failure.
   *
   * <p>An error that is a {@link RuntimeException} or an {@link Error} is thrown as it is. Any
   * other error, including a checked exception, is thrown inside an {@link UnwrapException} whose
   * {@link UnwrapException#getError()} is the very same object. Use {@link Results#unwrapChecked}
   * to rethrow a checked exception directly.
   */
  @Nullable
  public abstract V unwrap();

  /**
   * Returns the value of a success, otherwise throws the exception built from the error by
   * {@code exceptionMapper}.
   */
  @Nullable
  public abstract <X extends Throwable> V unwrapOrThrow(
      @Nonnull Function<? super E, ? extends X> exceptionMapper) throws X;

  /**
   * Returns the value of a success, otherwise {@code fallback}. The fallback is evaluated by the
   * caller whether or not it is needed; see {@link #orElseGet} for the lazy form.
   */
  @Nullable
  public abstract V or(@Nullable V fallback);

  /** Returns the value of a success, otherwise the value produced by {@code fallback}. */
  @Nullable
  public abstract V orElseGet(@Nonnull Supplier<? extends V> fallback);

  /** Applies {@code onOk} to the value of a success or {@code onErr} to the error of a failure. */
  public abstract <R> R match(
      @Nonnull Function<? super V, ? extends R> onOk,
      @Nonnull Function<? super E, ? extends R> onErr);

  /**
   * Wraps the error of this failure in a new {@link ErrorPayload} of the given type whose cause is
   * the current error.
   *
   * @throws IllegalStateException if this is a success
   */
  @Nonnull
  public final <U> Result<U, ErrorPayload> annotate(@Nonnull String type) {
    return annotate(type, Collections.emptyMap());
  }

  /**
   * Wraps the error of this failure in a new {@link ErrorPayload} carrying {@code type}, every
   * entry of {@code fields}, and the current error as its cause. This is how context is layered
   * onto a failure as it crosses from one part of a program to another.
   *
   * <p>A failure holds no value, so the annotated failure may stand in for a result of any value
   * type.
   *
   * @throws IllegalStateException if this is a success
   * @throws IllegalArgumentException if {@code fields} has a {@code type} or {@code cause} entry
   */
  @Nonnull
  public abstract <U> Result<U, ErrorPayload> annotate(
      @Nonnull String type, @Nonnull Map<String, ?> fields);

  /** Returns the value of a success as an Optional; empty for a failure or a null value. */
  @Nonnull
  public Optional<V> toOptional() {
    return isOk() ? Optional.ofNullable(getValue()) : Optional.empty();
  }

  /** Returns a stream of the value of a success, or an empty stream for a failure. */
  @Nonnull
  public Stream<V> stream() {
    return isOk() ? Stream.of(getValue()) : Stream.empty();
  }

  /** Returns the plain two-field record of this result. */
  @Nonnull
  public abstract ResultRecord<V, E> raw();

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Result<?, ?> other = (Result<?, ?>) obj;
    return isOk()
        ? Objects.equals(getValue(), other.getValue())
        : getError().equals(other.getError());
  }

  @Override
  public int hashCode() {
    return isOk() ? Objects.hash(true, getValue()) : Objects.hash(false, getError());
  }

  /**
   * A successful result.
   *
   * @param <V> the type of the value
   * @param <E> the error type this success stands in for
   */
  public static final class Ok<V, E> extends Result<V, E> {
    private final V value;

    private Ok(V value) {
      this.value = value;
    }

    @Override
    public boolean isOk() {
      return true;
    }

    @Override
    public V getValue() {
      return value;
    }

    @Override
    public E getError() {
      throw new IllegalStateException("Cannot get error from successful Result: " + this);
    }

    @Override
    public <U> Result<U, E> map(Function<? super V, ? extends U> mapper) {
      return new Ok<>(mapper.apply(value));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <F> Result<V, F> mapErr(Function<? super E, ? extends F> mapper) {
      // No error to rewrite; the error type parameter is phantom on a success.
      return (Result<V, F>) this;
    }

    @Override
    public <U> Result<U, E> flatMap(Function<? super V, Result<U, E>> mapper) {
      return checkNotNull(mapper.apply(value), "flatMap function returned null");
    }

    @Override
    public V unwrap() {
      return value;
    }

    @Override
    public <X extends Throwable> V unwrapOrThrow(Function<? super E, ? extends X> exceptionMapper) {
      return value;
    }

    @Override
    public V or(V fallback) {
      return value;
    }

    @Override
    public V orElseGet(Supplier<? extends V> fallback) {
      return value;
    }

    @Override
    public <R> R match(
        Function<? super V, ? extends R> onOk, Function<? super E, ? extends R> onErr) {
      return onOk.apply(value);
    }

    @Override
    public <U> Result<U, ErrorPayload> annotate(String type, Map<String, ?> fields) {
      throw new IllegalStateException("Cannot annotate a successful Result: " + this);
    }

    @Override
    public Iterator<V> iterator() {
      return Iterators.singletonIterator(value);
    }

    @Override
    public ResultRecord<V, E> raw() {
      return ResultRecord.ok(value);
    }

    @Override
    public String toString() {
      return "Ok{value=" + value + "}";
    }
  }

  /**
   * A failed result.
   *
   * @param <V> the value type this failure stands in for
   * @param <E> the type of the error
   */
  public static final class Err<V, E> extends Result<V, E> {
    private final E error;

    private Err(E error) {
      this.error = error;
    }

    @Override
    public boolean isOk() {
      return false;
    }

    @Override
    public V getValue() {
      throw new IllegalStateException("Cannot get value from failed Result: " + this);
    }

    @Override
    public E getError() {
      return error;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <U> Result<U, E> map(Function<? super V, ? extends U> mapper) {
      return (Result<U, E>) this;
    }

    @Override
    public <F> Result<V, F> mapErr(Function<? super E, ? extends F> mapper) {
      return Result.err(mapper.apply(error));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <U> Result<U, E> flatMap(Function<? super V, Result<U, E>> mapper) {
      return (Result<U, E>) this;
    }

    @Override
    public V unwrap() {
      if (error instanceof RuntimeException) {
        throw (RuntimeException) error;
      }
      if (error instanceof Error) {
        throw (Error) error;
      }
      throw new UnwrapException(error);
    }

    @Override
    public <X extends Throwable> V unwrapOrThrow(Function<? super E, ? extends X> exceptionMapper)
        throws X {
      throw exceptionMapper.apply(error);
    }

    @Override
    public V or(V fallback) {
      return fallback;
    }

    @Override
    public V orElseGet(Supplier<? extends V> fallback) {
      return fallback.get();
    }

    @Override
    public <R> R match(
        Function<? super V, ? extends R> onOk, Function<? super E, ? extends R> onErr) {
      return onErr.apply(error);
    }

    @Override
    public <U> Result<U, ErrorPayload> annotate(String type, Map<String, ?> fields) {
      if (fields.containsKey(ErrorPayload.CAUSE_KEY)) {
        throw new IllegalArgumentException(
            "Annotation fields must not set 'cause'; the annotated error is the cause");
      }
      return Result.err(ErrorPayload.builder(type).putAll(fields).cause(error).build());
    }

    @Override
    public Iterator<V> iterator() {
      return Collections.emptyIterator();
    }

    @Override
    public ResultRecord<V, E> raw() {
      return ResultRecord.err(error);
    }

    @Override
    public String toString() {
      return "Err{error=" + error + "}";
    }
  }
}
