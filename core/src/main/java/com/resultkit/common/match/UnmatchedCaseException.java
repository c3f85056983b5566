package com.resultkit.common.match;

import com.google.common.collect.ImmutableSet;

/** Raised when a discriminant has no arm in the {@link Cases} it is matched against. */
public class UnmatchedCaseException extends RuntimeException {
  private final String discriminant;
  private final ImmutableSet<String> knownCases;

  public UnmatchedCaseException(String discriminant, ImmutableSet<String> knownCases) {
    super("No case for '" + discriminant + "'; known cases: " + knownCases);
    this.discriminant = discriminant;
    this.knownCases = knownCases;
  }

  /** Returns the discriminant that failed to match. */
  public String getDiscriminant() {
    return discriminant;
  }

  /** Returns the discriminants the cases do handle. */
  public ImmutableSet<String> getKnownCases() {
    return knownCases;
  }
}
