package com.gentoro.morphie.exception;

/** A raw value cannot be represented under the requested type. */
public class TypeMismatchException extends MorphieException {
  public TypeMismatchException(String message) {
    super(MorphieErrorCode.TYPE_MISMATCH, message);
  }

  public TypeMismatchException(String message, Throwable cause) {
    super(MorphieErrorCode.TYPE_MISMATCH, message, cause);
  }
}
