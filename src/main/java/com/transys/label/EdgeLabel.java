package com.transys.label;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Label of a single edge: an ordered mapping from edge field (for example {@code actions}) to a value
 * of that field's alphabet. The empty label marks an unlabeled edge.
 */
public final class EdgeLabel {
  private static final EdgeLabel EMPTY = new EdgeLabel(ImmutableMap.of());

  private final ImmutableMap<String, Object> values;
  private final int hashCode;

  private EdgeLabel(ImmutableMap<String, Object> values) {
    this.values = values;
    this.hashCode = values.hashCode();
  }

  public static EdgeLabel empty() {
    return EMPTY;
  }

  public static EdgeLabel of(String field, Object value) {
    return new EdgeLabel(ImmutableMap.of(field, requireNonNull(value, "Missing value for " + field)));
  }

  public static EdgeLabel of(Map<String, ?> values) {
    return values.isEmpty() ? EMPTY : new EdgeLabel(ImmutableMap.copyOf(values));
  }

  /**
   * Label of a joint move: every field carried by both labels maps to the pair of their values,
   * ordered as in {@code left}.
   */
  public static EdgeLabel paired(EdgeLabel left, EdgeLabel right) {
    ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
    left.values.forEach((field, value) -> {
      @Nullable
      Object other = right.values.get(field);
      if (other != null) {
        builder.put(field, new Pair<>(value, other));
      }
    });
    return of(builder.build());
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Map<String, Object> values() {
    return values;
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj || (obj instanceof EdgeLabel that && hashCode == that.hashCode && values.equals(that.values));
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
