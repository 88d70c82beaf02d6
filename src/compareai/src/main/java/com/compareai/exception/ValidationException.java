package com.compareai.exception;

/** Input rejected before any work was scheduled. */
public class ValidationException extends CompareAiException {
  public ValidationException(String message) {
    super(ErrorCode.INVALID_ARGUMENT, message);
  }
}
