package com.gentoro.morphie.exception;

/** An operation was called in the wrong lifecycle state, such as building before initializing. */
public class StateException extends MorphieException {
  public StateException(String message) {
    super(MorphieErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(MorphieErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
