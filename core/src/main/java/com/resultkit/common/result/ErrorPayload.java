package com.resultkit.common.result;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The conventional error carried by a typed failure: a string discriminant, any number of context
 * fields, and an optional cause.
 *
 * <p>On the wire an error payload is a flat object, {@code {"type": ..., ...fields, "cause": ...}}.
 * The {@code type} and {@code cause} keys are reserved; everything else is caller context. The
 * cause is normally another {@code ErrorPayload} built earlier, which makes a chain of errors
 * running from the most specific context to the least specific one. Payloads are immutable, so a
 * chain can only ever point at values that already existed when it was built and cannot contain a
 * cycle.
 */
public final class ErrorPayload {
  /** Reserved key holding the discriminant. */
  public static final String TYPE_KEY = "type";

  /** Reserved key holding the wrapped prior error. */
  public static final String CAUSE_KEY = "cause";

  private final String type;
  private final ImmutableMap<String, Object> fields;
  private final Object cause;

  private ErrorPayload(String type, ImmutableMap<String, Object> fields, Object cause) {
    this.type = type;
    this.fields = fields;
    this.cause = cause;
  }

  /** Creates a payload carrying only a discriminant. */
  public static ErrorPayload of(@Nonnull String type) {
    return builder(type).build();
  }

  /**
   * Creates a payload from a discriminant and a map of context fields.
   *
   * <p>A {@code cause} entry in {@code fields} becomes the payload's cause.
   *
   * @throws IllegalArgumentException if {@code fields} contains a {@code type} entry
   */
  public static ErrorPayload of(@Nonnull String type, @Nonnull Map<String, ?> fields) {
    return builder(type).putAll(fields).build();
  }

  /** Returns a builder for a payload with the given discriminant. */
  public static Builder builder(@Nonnull String type) {
    return new Builder(type);
  }

  /** Returns the discriminant. */
  @Nonnull
  public String type() {
    return type;
  }

  /** Returns the context fields, excluding {@code type} and {@code cause}, in insertion order. */
  @Nonnull
  public ImmutableMap<String, Object> fields() {
    return fields;
  }

  /**
   * Returns the value stored under {@code key}, including the reserved keys, or null if absent.
   */
  @Nullable
  public Object get(String key) {
    if (TYPE_KEY.equals(key)) {
      return type;
    }
    if (CAUSE_KEY.equals(key)) {
      return cause;
    }
    return fields.get(key);
  }

  /** Returns true if a context field named {@code key} is present. */
  public boolean has(String key) {
    return fields.containsKey(key);
  }

  /** Returns the wrapped prior error, if any. */
  @Nonnull
  public Optional<Object> cause() {
    return Optional.ofNullable(cause);
  }

  /** Returns the wrapped prior error if it is itself an error payload. */
  @Nonnull
  public Optional<ErrorPayload> causePayload() {
    return cause instanceof ErrorPayload ? Optional.of((ErrorPayload) cause) : Optional.empty();
  }

  /**
   * Returns this payload followed by every error reachable through {@code cause}, outermost first.
   * The last element may be a non-payload error, such as a captured exception.
   */
  @Nonnull
  public ImmutableList<Object> causeChain() {
    ImmutableList.Builder<Object> chain = ImmutableList.builder();
    Object current = this;
    while (current != null) {
      chain.add(current);
      current = current instanceof ErrorPayload ? ((ErrorPayload) current).cause : null;
    }
    return chain.build();
  }

  /** Returns the innermost error of the chain, which is this payload when there is no cause. */
  @Nonnull
  public Object rootCause() {
    ImmutableList<Object> chain = causeChain();
    return chain.get(chain.size() - 1);
  }

  /**
   * Returns the flat wire-shape map: {@code type}, then the fields, then {@code cause} when
   * present. A payload cause is flattened recursively.
   */
  @Nonnull
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(TYPE_KEY, type);
    map.putAll(fields);
    if (cause != null) {
      map.put(CAUSE_KEY, cause instanceof ErrorPayload ? ((ErrorPayload) cause).toMap() : cause);
    }
    return map;
  }

  @Override
  public String toString() {
    MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this).add(TYPE_KEY, type);
    fields.forEach(helper::add);
    return helper.add(CAUSE_KEY, cause).omitNullValues().toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    ErrorPayload other = (ErrorPayload) obj;
    return type.equals(other.type)
        && fields.equals(other.fields)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, fields, cause);
  }

  /** Accumulates the context fields and cause of a payload. */
  public static final class Builder {
    private final String type;
    private final Map<String, Object> fields = new LinkedHashMap<>();
    private Object cause;

    private Builder(String type) {
      checkArgument(!Strings.isNullOrEmpty(type), "Error type must not be empty");
      this.type = type;
    }

    /**
     * Adds a context field. A {@code cause} key sets the cause instead.
     *
     * <p>Numbers are stored in the form JSON gives them back: a {@code Byte}, {@code Short} or
     * {@code Long} becomes an {@code Integer} when it fits, and a {@code Float} becomes the {@code
     * Double} with the same decimal text. {@code ms = 1000L} is therefore stored as {@code 1000}.
     *
     * @throws IllegalArgumentException if {@code key} is {@code type}
     */
    public Builder put(@Nonnull String key, @Nonnull Object value) {
      checkNotNull(key, "Field name must not be null");
      checkNotNull(value, "Field '%s' must not be null", key);
      checkArgument(!TYPE_KEY.equals(key), "'%s' is reserved for the error discriminant", TYPE_KEY);
      if (CAUSE_KEY.equals(key)) {
        return cause(value);
      }
      fields.put(key, canonicalNumber(value));
      return this;
    }

    /** Adds every entry of {@code entries} as if by {@link #put}. */
    public Builder putAll(@Nonnull Map<String, ?> entries) {
      entries.forEach(this::put);
      return this;
    }

    /** Sets the wrapped prior error. */
    public Builder cause(@Nonnull Object cause) {
      this.cause = checkNotNull(cause, "Cause must not be null");
      return this;
    }

    private static Object canonicalNumber(Object value) {
      if (value instanceof Byte || value instanceof Short || value instanceof Long) {
        long integral = ((Number) value).longValue();
        if (integral >= Integer.MIN_VALUE && integral <= Integer.MAX_VALUE) {
          return (int) integral;
        }
        return integral;
      }
      if (value instanceof Float) {
        return Double.valueOf(value.toString());
      }
      return value;
    }

    public ErrorPayload build() {
      return new ErrorPayload(type, ImmutableMap.copyOf(fields), cause);
    }
  }
}
