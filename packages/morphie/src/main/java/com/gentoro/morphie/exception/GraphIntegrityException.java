package com.gentoro.morphie.exception;

/** An edge refers to a node that does not exist in the graph. */
public class GraphIntegrityException extends MorphieException {
  public GraphIntegrityException(String message) {
    super(MorphieErrorCode.REFERENTIAL_INTEGRITY, message);
  }

  public GraphIntegrityException(String message, Throwable cause) {
    super(MorphieErrorCode.REFERENTIAL_INTEGRITY, message, cause);
  }
}
