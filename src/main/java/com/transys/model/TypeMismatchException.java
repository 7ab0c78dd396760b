package com.transys.model;

import com.transys.label.LabelSchema;

public class TypeMismatchException extends RuntimeException {
  public TypeMismatchException(String message) {
    super(message);
  }

  static TypeMismatchException of(String operation, LabelSchema.Kind expected, LabelSchema.Kind actual) {
    return new TypeMismatchException("Cannot compute %s of a %s system with a %s system"
        .formatted(operation, expected, actual));
  }
}
