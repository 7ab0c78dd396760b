package com.transys.graph;

import java.util.Set;

public class DuplicateStateException extends RuntimeException {
  public DuplicateStateException(Object state, Set<String> existing, Set<String> requested) {
    super("State %s already exists with label %s, cannot re-add it with label %s"
        .formatted(state, existing, requested));
  }
}
