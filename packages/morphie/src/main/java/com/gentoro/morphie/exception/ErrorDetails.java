package com.gentoro.morphie.exception;

import java.util.Map;

/** Lightweight DTO exposing structured error information to logs and the command line. */
public final class ErrorDetails {
  public final String type;
  public final String message;
  public final MorphieErrorCode code;
  public final Map<String, Object> context;
  public final boolean fatal;

  public ErrorDetails(
      String type,
      String message,
      MorphieErrorCode code,
      Map<String, Object> context,
      boolean fatal) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.context = context;
    this.fatal = fatal;
  }

  @Override
  public String toString() {
    return "[" + code + "] " + type + ": " + message + (context.isEmpty() ? "" : " " + context);
  }
}
