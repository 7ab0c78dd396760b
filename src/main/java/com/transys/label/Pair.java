package com.transys.label;

import com.transys.output.DotFormatted;

public record Pair<A, B>(A first, B second) implements DotFormatted {
  @Override
  public String toString() {
    return "(%s, %s)".formatted(first, second);
  }

  @Override
  public String dotString() {
    return "(%s, %s)".formatted(DotFormatted.toDotString(first), DotFormatted.toDotString(second));
  }
}
