package com.transys.graph;

import com.transys.label.EdgeLabel;

public record Transition<S>(S source, S target, EdgeLabel label) {
  public boolean isLabeled() {
    return !label.isEmpty();
  }

  @Override
  public String toString() {
    return isLabeled() ? "%s -%s-> %s".formatted(source, label, target) : source + " -> " + target;
  }
}
