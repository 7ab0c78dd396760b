package com.transys.model;

import com.transys.output.DotFormatted;

public record ProductState<L, R>(L left, R right) implements DotFormatted {
  @Override
  public String toString() {
    return "(%s, %s)".formatted(left, right);
  }

  @Override
  public String dotString() {
    return "%s x %s".formatted(DotFormatted.toDotString(left), DotFormatted.toDotString(right));
  }
}
