package com.gentoro.morphie.exception;

/** JSON, CSV or YAML content could not be parsed or written. */
public class SerializationException extends MorphieException {
  public SerializationException(String message) {
    super(MorphieErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(MorphieErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
