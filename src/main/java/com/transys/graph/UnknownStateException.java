package com.transys.graph;

public class UnknownStateException extends RuntimeException {
  private final Object state;

  public UnknownStateException(Object state) {
    super("Unknown state " + state);
    this.state = state;
  }

  public Object state() {
    return state;
  }
}
