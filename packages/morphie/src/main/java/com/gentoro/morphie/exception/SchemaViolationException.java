package com.gentoro.morphie.exception;

import java.util.Map;

/** A node or edge label (or attribute) does not conform to the type registered for its tag. */
public class SchemaViolationException extends MorphieException {
  public SchemaViolationException(String message) {
    super(MorphieErrorCode.SCHEMA_VIOLATION, message);
  }

  public SchemaViolationException(String message, Map<String, ?> context) {
    super(MorphieErrorCode.SCHEMA_VIOLATION, message, context);
  }
}
