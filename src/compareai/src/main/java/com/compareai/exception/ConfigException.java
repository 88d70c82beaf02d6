package com.compareai.exception;

/** Invalid or missing configuration detected while wiring backends. */
public class ConfigException extends CompareAiException {
  public ConfigException(String message) {
    super(ErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
