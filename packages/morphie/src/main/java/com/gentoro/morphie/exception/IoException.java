package com.gentoro.morphie.exception;

/** Reading or writing a file failed. */
public class IoException extends MorphieException {
  public IoException(String message) {
    super(MorphieErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(MorphieErrorCode.IO_ERROR, message, cause);
  }
}
