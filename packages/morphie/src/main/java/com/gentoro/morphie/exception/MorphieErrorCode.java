package com.gentoro.morphie.exception;

/**
 * Canonical error codes for Morphie. Codes are stable and suitable for logs and for callers that
 * decide whether a failure can be skipped. Prefer the most specific code that reflects the failure
 * origin.
 */
public enum MorphieErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  INTERNAL,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Typed graph
  TYPE_MISMATCH,
  SCHEMA_VIOLATION,
  REFERENTIAL_INTEGRITY,
}
