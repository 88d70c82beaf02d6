package com.compareai.protocols;

import com.compareai.exception.CompareAiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/** Maps domain exceptions to JSON error bodies. */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger LOG = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(CompareAiException.class)
  public ResponseEntity<Map<String, Object>> handle(CompareAiException e) {
    HttpStatus status = switch (e.getCode()) {
      case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
      case NOT_FOUND -> HttpStatus.NOT_FOUND;
      case ALREADY_EXISTS -> HttpStatus.CONFLICT;
      case FAILED_PRECONDITION -> HttpStatus.SERVICE_UNAVAILABLE;
      case BACKEND_ERROR -> HttpStatus.BAD_GATEWAY;
      default -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
    if (status.is5xxServerError()) {
      LOG.error("Request failed", e);
    } else {
      LOG.debug("Request rejected: {}", e.toString());
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", e.getMessage());
    body.put("code", e.getCode().name());
    if (!e.getContext().isEmpty()) body.put("details", e.getContext());
    return ResponseEntity.status(status).body(body);
  }
}
