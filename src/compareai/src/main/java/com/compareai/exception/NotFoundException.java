package com.compareai.exception;

import java.util.Map;

/** Resource requested was not found. */
public class NotFoundException extends CompareAiException {
  public NotFoundException(String message) {
    super(ErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(ErrorCode.NOT_FOUND, message, context);
  }
}
