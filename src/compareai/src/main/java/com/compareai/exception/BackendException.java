package com.compareai.exception;

/** Errors raised while calling a provider or interpreting its response. */
public class BackendException extends CompareAiException {
  public BackendException(String message) {
    super(ErrorCode.BACKEND_ERROR, message);
  }

  public BackendException(String message, Throwable cause) {
    super(ErrorCode.BACKEND_ERROR, message, cause);
  }
}
