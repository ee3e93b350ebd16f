package com.gentoro.morphie.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends MorphieException {
  public ValidationException(String message) {
    super(MorphieErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(MorphieErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
