package com.resultkit.common.result;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.resultkit.common.match.Cases;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Free-function forms of the {@link Result} operations, constructors for typed failures, and the
 * adapters that turn foreign outcomes into results.
 *
 * <p>Every combinator here takes the result first and forwards to the method of the same name on
 * {@link Result}; the two spellings behave identically.
 *
 * <p>The {@code result(...)} overloads accept the three kinds of operand a result can be made from:
 *
 * <ul>
 *   <li>a {@link Callable}, run immediately; an exception it throws becomes the failure's error;
 *   <li>a {@link CompletionStage} or {@link ListenableFuture}, whose eventual outcome becomes the
 *       outcome of the returned future;
 *   <li>a {@link ResultRecord} or a plain {@code Map} in the result shape, rebuilt into a live
 *       result.
 * </ul>
 */
public final class Results {

  private Results() {
    // Utility class, no instances
  }

  // Constructors

  /** Creates a success carrying {@code value}. */
  public static <V, E> Result<V, E> ok(@Nullable V value) {
    return Result.ok(value);
  }

  /** Creates a success that carries no value. */
  public static <V, E> Result<V, E> ok() {
    return Result.ok();
  }

  /** Creates a typed failure whose error carries only {@code type}. */
  public static <V> Result<V, ErrorPayload> err(@Nonnull String type) {
    return Result.err(ErrorPayload.of(type));
  }

  /**
   * Creates a typed failure whose error carries {@code type} and every entry of {@code fields}. A
   * {@code cause} entry, as produced by {@link #cause(Result)}, becomes the error's cause.
   */
  public static <V> Result<V, ErrorPayload> err(
      @Nonnull String type, @Nonnull Map<String, ?> fields) {
    return Result.err(ErrorPayload.of(type, fields));
  }

  /** Creates a failure carrying any error value as it is. */
  public static <V, E> Result<V, E> errAny(@Nonnull E error) {
    return Result.err(error);
  }

  /**
   * Returns {@code {cause: error}} for a failure, to pass as the fields of {@link #err(String,
   * Map)}. {@code err("B", cause(previous))} is equivalent to {@code annotate(previous, "B")}.
   *
   * @throws IllegalStateException if {@code result} is a success
   */
  public static ImmutableMap<String, Object> cause(@Nonnull Result<?, ?> result) {
    return ImmutableMap.of(ErrorPayload.CAUSE_KEY, result.getError());
  }

  // Combinators

  /** See {@link Result#map}. */
  public static <V, E, U> Result<U, E> map(
      @Nonnull Result<V, E> result, @Nonnull Function<? super V, ? extends U> mapper) {
    return result.map(mapper);
  }

  /** See {@link Result#mapErr}. */
  public static <V, E, F> Result<V, F> mapErr(
      @Nonnull Result<V, E> result, @Nonnull Function<? super E, ? extends F> mapper) {
    return result.mapErr(mapper);
  }

  /** See {@link Result#flatMap}. */
  public static <V, E, U> Result<U, E> flatMap(
      @Nonnull Result<V, E> result, @Nonnull Function<? super V, Result<U, E>> mapper) {
    return result.flatMap(mapper);
  }

  /** See {@link Result#unwrap}. */
  @Nullable
  public static <V> V unwrap(@Nonnull Result<V, ?> result) {
    return result.unwrap();
  }

  /** Returns the value of a success, or throws the checked exception held by a failure as is. */
  @Nullable
  public static <V, X extends Exception> V unwrapChecked(@Nonnull Result<V, X> result) throws X {
    if (result.isOk()) {
      return result.getValue();
    }
    throw result.getError();
  }

  /**
   * See {@link Result#or}. The fallback need not have the value's type: the result is typed as
   * their common supertype, so {@code orElse(count, "none")} is an {@code Object}.
   */
  @Nullable
  public static <V> V orElse(@Nonnull Result<? extends V, ?> result, @Nullable V fallback) {
    return result.isOk() ? result.getValue() : fallback;
  }

  /** See {@link Result#orElseGet}. Typed like {@link #orElse}. */
  @Nullable
  public static <V> V orElseGet(
      @Nonnull Result<? extends V, ?> result, @Nonnull Supplier<? extends V> fallback) {
    checkNotNull(fallback, "fallback");
    return result.isOk() ? result.getValue() : fallback.get();
  }

  /** See {@link Result#annotate(String, Map)}. */
  public static <V> Result<V, ErrorPayload> annotate(
      @Nonnull Result<?, ?> result, @Nonnull String type) {
    return result.annotate(type);
  }

  /** See {@link Result#annotate(String, Map)}. */
  public static <V> Result<V, ErrorPayload> annotate(
      @Nonnull Result<?, ?> result, @Nonnull String type, @Nonnull Map<String, ?> fields) {
    return result.annotate(type, fields);
  }

  /**
   * Concatenates the sequence views of {@code results}: the returned iterable yields the value of
   * every success, in order, and skips every failure.
   */
  public static <V> Iterable<V> values(
      @Nonnull Iterable<? extends Result<? extends V, ?>> results) {
    return Iterables.concat(results);
  }

  // Matching

  /** See {@link Result#match}. */
  public static <V, E, R> R match(
      @Nonnull Result<V, E> result,
      @Nonnull Function<? super V, ? extends R> onOk,
      @Nonnull Function<? super E, ? extends R> onErr) {
    return result.match(onOk, onErr);
  }

  /** Dispatches on a discriminant string. See {@link Cases#apply(String)}. */
  public static <R> R match(@Nonnull String discriminant, @Nonnull Cases<R> cases) {
    return cases.apply(discriminant);
  }

  /** Dispatches on an enum discriminant by name. See {@link Cases#apply(Enum)}. */
  public static <R> R match(@Nonnull Enum<?> discriminant, @Nonnull Cases<R> cases) {
    return cases.apply(discriminant);
  }

  /** Dispatches on the type of an error payload. See {@link Cases#apply(ErrorPayload)}. */
  public static <R> R match(@Nonnull ErrorPayload error, @Nonnull Cases<R> cases) {
    return cases.apply(error);
  }

  // Adapters

  /**
   * Runs {@code work} now, in the calling thread. Its return value becomes a success; anything it
   * throws, {@code Error}s included, becomes a failure carrying that throwable. Nothing is
   * rethrown, which matches what the future adapters report for the same failure.
   */
  public static <V> Result<V, Throwable> result(@Nonnull Callable<? extends V> work) {
    checkNotNull(work, "work");
    try {
      return Result.ok(work.call());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Result.err(e);
    } catch (Throwable t) {
      return Result.err(t);
    }
  }

  /**
   * Returns a future that completes with a success when {@code work} completes normally and with a
   * failure carrying the original exception when it completes exceptionally. The returned future
   * itself never completes exceptionally.
   */
  public static <V> CompletableFuture<Result<V, Throwable>> result(
      @Nonnull CompletionStage<? extends V> work) {
    checkNotNull(work, "work");
    return work
        .<Result<V, Throwable>>handle(
            (value, failure) ->
                failure == null ? Result.ok(value) : Result.err(unwrapCompletion(failure)))
        .toCompletableFuture();
  }

  /**
   * Returns a future that succeeds with a success when {@code work} succeeds and with a failure
   * carrying the original exception when it fails or is cancelled.
   */
  public static <V> ListenableFuture<Result<V, Throwable>> result(
      @Nonnull ListenableFuture<? extends V> work) {
    checkNotNull(work, "work");
    ListenableFuture<Result<V, Throwable>> succeeded =
        Futures.transform(work, Result::<V, Throwable>ok, directExecutor());
    return Futures.catching(
        succeeded, Throwable.class, Result::<V, Throwable>err, directExecutor());
  }

  /** Returns {@code result} itself; a live result needs no conversion. */
  public static <V, E> Result<V, E> result(@Nonnull Result<V, E> result) {
    return checkNotNull(result, "result");
  }

  /**
   * Rebuilds a live result from its plain record.
   *
   * @throws IllegalArgumentException if the populated side disagrees with {@code ok}
   */
  public static <V, E> Result<V, E> result(@Nonnull ResultRecord<V, E> record) {
    checkNotNull(record, "record");
    checkArgument(record.isWellFormed(), "Malformed result record: %s", record);
    return record.ok() ? Result.ok(record.value()) : Result.err(record.error());
  }

  /**
   * Rebuilds a live result from a map in the result shape.
   *
   * @throws IllegalArgumentException if the map has no boolean {@code ok} entry or is malformed
   */
  public static <V, E> Result<V, E> result(@Nonnull Map<String, ?> map) {
    return result(ResultRecord.<V, E>fromMap(map));
  }

  /** Same as {@link #result(ResultRecord)}. */
  public static <V, E> Result<V, E> rehydrate(@Nonnull ResultRecord<V, E> record) {
    return result(record);
  }

  /** Same as {@link #result(Map)}. */
  public static <V, E> Result<V, E> rehydrate(@Nonnull Map<String, ?> map) {
    return result(map);
  }

  private static Throwable unwrapCompletion(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
