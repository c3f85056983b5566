package com.resultkit.common.result;

/**
 * Raised by {@link Result#unwrap()} on a failure whose error cannot be thrown directly: a checked
 * exception or a value that is not a {@link Throwable} at all.
 *
 * <p>{@link #getError()} returns the failure's error object itself. When that error is a {@code
 * Throwable} it is also this exception's cause.
 */
public class UnwrapException extends RuntimeException {
  private final transient Object error;

  public UnwrapException(Object error) {
    super("Called unwrap() on a failed Result: " + error,
        error instanceof Throwable ? (Throwable) error : null);
    this.error = error;
  }

  /** Returns the error of the unwrapped failure. */
  public Object getError() {
    return error;
  }
}
