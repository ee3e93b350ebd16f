package com.gentoro.morphie.exception;

/** Configuration could not be loaded or holds an invalid value. */
public class ConfigException extends MorphieException {
  public ConfigException(String message) {
    super(MorphieErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(MorphieErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
