package com.compareai.exception;

/** Operation not allowed in the current state of the component. */
public class StateException extends CompareAiException {
  public StateException(String message) {
    super(ErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(ErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
