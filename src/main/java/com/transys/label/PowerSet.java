package com.transys.label;

import java.util.Collection;
import java.util.List;

/**
 * The power set of a base {@link MathSet}. Membership is the subset test against the current base, so
 * growing the base keeps every admitted subset a member.
 */
public final class PowerSet<T> {
  private final MathSet<T> base;

  public PowerSet(MathSet<T> base) {
    this.base = base;
  }

  public MathSet<T> base() {
    return base;
  }

  public boolean contains(Collection<?> candidate) {
    return candidate.stream().allMatch(base::contains);
  }

  public void checkMember(Collection<?> candidate) {
    List<?> outside = candidate.stream().filter(element -> !base.contains(element)).toList();
    if (!outside.isEmpty()) {
      throw new DomainException("Label %s is not a subset of %s, offending elements %s"
          .formatted(candidate, base, outside));
    }
  }

  @Override
  public String toString() {
    return "2^" + base;
  }
}
