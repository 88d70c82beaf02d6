package com.compareai.exception;

/**
 * Stable error codes surfaced in logs and REST error bodies. Prefer the most specific code that
 * reflects where the failure originated.
 */
public enum ErrorCode {
  UNKNOWN,
  INVALID_ARGUMENT,
  NOT_FOUND,
  ALREADY_EXISTS,
  FAILED_PRECONDITION,
  CONFIGURATION_ERROR,
  BACKEND_ERROR,
}
