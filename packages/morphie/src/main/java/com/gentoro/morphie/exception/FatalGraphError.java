package com.gentoro.morphie.exception;

import java.util.Map;
import java.util.Objects;

/**
 * Violation of a usage contract of the graph engine: an operation on an uninitialized graph, a
 * second initialization, or a handle the graph never issued.
 *
 * <p>This is an {@link Error}: the frontend does not catch it and the process terminates instead of
 * exporting a graph whose invariants no longer hold.
 */
public class FatalGraphError extends Error {
  private final MorphieErrorCode code;
  private final Map<String, Object> context;

  public FatalGraphError(MorphieErrorCode code, String message) {
    this(code, message, Map.of());
  }

  public FatalGraphError(MorphieErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = MorphieException.copy(context);
  }

  public MorphieErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }
}
