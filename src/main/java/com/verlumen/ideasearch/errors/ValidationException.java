package com.verlumen.ideasearch.errors;

/** Thrown when a caller supplies malformed input, such as a blank description. Never retried. */
public class ValidationException extends RuntimeException {
  public ValidationException(String message) {
    super(message);
  }
}
