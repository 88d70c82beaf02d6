package com.compareai.exception;

public class AlreadyExistsException extends CompareAiException {
  public AlreadyExistsException(String message) {
    super(ErrorCode.ALREADY_EXISTS, message);
  }
}
