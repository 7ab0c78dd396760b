package com.transys.label;

/**
 * A label value lies outside the universe it is drawn from. The universe has to be grown explicitly
 * before such a value can be used.
 */
public class DomainException extends RuntimeException {
  public DomainException(String message) {
    super(message);
  }
}
