package com.resultkit.common.match;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.resultkit.common.result.ErrorPayload;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A table of arms keyed by error discriminant, used to answer "which failure was it?" once a
 * result is known to have failed.
 *
 * <p>An arm either takes no argument or receives the whole {@link ErrorPayload}, so that the fields
 * next to the discriminant are reachable. A discriminant without an arm raises {@link
 * UnmatchedCaseException}; there is no default arm.
 *
 * <p>When the set of possible discriminants is known, declare it with {@link #builder(Set)} or
 * {@link #forEnum(Class)}. {@link Builder#build()} then refuses a table that leaves any of them
 * out, so a new kind of error cannot be added without every table that dispatches on it being
 * updated.
 *
 * <pre>
 * Cases&lt;Duration&gt; retryDelay = Cases.&lt;Duration&gt;builder(Set.of("Timeout", "Busy"))
 *     .onPayload("Timeout", e -&gt; Duration.ofMillis((Integer) e.get("ms")))
 *     .on("Busy", () -&gt; Duration.ofSeconds(1))
 *     .build();
 * </pre>
 *
 * @param <R> the type every arm returns
 */
public final class Cases<R> {
  private final ImmutableMap<String, Function<? super ErrorPayload, ? extends R>> arms;

  private Cases(ImmutableMap<String, Function<? super ErrorPayload, ? extends R>> arms) {
    this.arms = arms;
  }

  /** Returns a builder that accepts any discriminant. */
  public static <R> Builder<R> builder() {
    return new Builder<>(null);
  }

  /** Returns a builder whose table must cover exactly {@code domain}. */
  public static <R> Builder<R> builder(@Nonnull Set<String> domain) {
    checkArgument(!domain.isEmpty(), "Discriminant domain must not be empty");
    return new Builder<>(ImmutableSet.copyOf(domain));
  }

  /** Returns a builder whose table must cover every constant of {@code enumType}, by name. */
  public static <R> Builder<R> forEnum(@Nonnull Class<? extends Enum<?>> enumType) {
    Enum<?>[] constants = enumType.getEnumConstants();
    checkArgument(constants != null && constants.length > 0,
        "%s declares no constants", enumType.getName());
    return builder(Arrays.stream(constants).map(Enum::name).collect(ImmutableSet.toImmutableSet()));
  }

  /**
   * Invokes the arm for {@code discriminant}. A payload arm receives a payload carrying only the
   * discriminant.
   *
   * @throws UnmatchedCaseException if no arm handles the discriminant
   */
  public R apply(@Nonnull String discriminant) {
    return arm(discriminant).apply(ErrorPayload.of(discriminant));
  }

  /** Invokes the arm named by the constant's {@link Enum#name()}. */
  public R apply(@Nonnull Enum<?> discriminant) {
    return apply(discriminant.name());
  }

  /**
   * Invokes the arm for the payload's type, handing it the full payload.
   *
   * @throws UnmatchedCaseException if no arm handles the type
   */
  public R apply(@Nonnull ErrorPayload error) {
    return arm(error.type()).apply(error);
  }

  /** Returns the discriminants this table handles. */
  public ImmutableSet<String> discriminants() {
    return arms.keySet();
  }

  /** Returns true if an arm exists for {@code discriminant}. */
  public boolean handles(String discriminant) {
    return arms.containsKey(discriminant);
  }

  private Function<? super ErrorPayload, ? extends R> arm(String discriminant) {
    checkNotNull(discriminant, "Discriminant must not be null");
    Function<? super ErrorPayload, ? extends R> arm = arms.get(discriminant);
    if (arm == null) {
      throw new UnmatchedCaseException(discriminant, arms.keySet());
    }
    return arm;
  }

  @Override
  public String toString() {
    return "Cases" + arms.keySet();
  }

  /**
   * Collects the arms of a {@link Cases} table.
   *
   * @param <R> the type every arm returns
   */
  public static final class Builder<R> {
    private final ImmutableSet<String> domain;
    private final Map<String, Function<? super ErrorPayload, ? extends R>> arms =
        new LinkedHashMap<>();

    private Builder(@Nullable ImmutableSet<String> domain) {
      this.domain = domain;
    }

    /** Adds an arm that takes no argument. */
    public Builder<R> on(@Nonnull String discriminant, @Nonnull Supplier<? extends R> arm) {
      checkNotNull(arm, "Arm for '%s' must not be null", discriminant);
      return add(discriminant, error -> arm.get());
    }

    /** Adds a no-argument arm for the constant's name. */
    public Builder<R> on(@Nonnull Enum<?> discriminant, @Nonnull Supplier<? extends R> arm) {
      return on(discriminant.name(), arm);
    }

    /** Adds an arm that receives the full error payload. */
    public Builder<R> onPayload(
        @Nonnull String discriminant, @Nonnull Function<? super ErrorPayload, ? extends R> arm) {
      checkNotNull(arm, "Arm for '%s' must not be null", discriminant);
      return add(discriminant, arm);
    }

    private Builder<R> add(String discriminant, Function<? super ErrorPayload, ? extends R> arm) {
      checkNotNull(discriminant, "Discriminant must not be null");
      checkArgument(!discriminant.isEmpty(), "Discriminant must not be empty");
      checkArgument(domain == null || domain.contains(discriminant),
          "'%s' is not one of %s", discriminant, domain);
      checkArgument(!arms.containsKey(discriminant), "Duplicate case '%s'", discriminant);
      arms.put(discriminant, arm);
      return this;
    }

    /**
     * Builds the table.
     *
     * @throws IllegalStateException if a declared discriminant has no arm
     */
    public Cases<R> build() {
      if (domain != null) {
        Set<String> missing = Sets.difference(domain, arms.keySet());
        checkState(missing.isEmpty(), "Cases are not exhaustive; missing %s", missing);
      }
      return new Cases<>(ImmutableMap.copyOf(arms));
    }
  }
}
