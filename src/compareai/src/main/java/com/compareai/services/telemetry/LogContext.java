package com.compareai.services.telemetry;

import org.slf4j.MDC;

/**
 * MDC scope putting the request, session and (optionally) backend of the current unit of work into
 * every log line. Keys set by this scope are removed on close.
 */
public final class LogContext implements AutoCloseable {
  private final boolean backendSet;

  public LogContext(String requestId, String sessionId) {
    this(requestId, sessionId, null);
  }

  public LogContext(String requestId, String sessionId, String backendKey) {
    if (requestId != null) MDC.put(TelemetryConstants.MDC_REQUEST_ID, requestId);
    if (sessionId != null) MDC.put(TelemetryConstants.MDC_SESSION_ID, sessionId);
    backendSet = backendKey != null;
    if (backendSet) MDC.put(TelemetryConstants.MDC_BACKEND, backendKey);
  }

  @Override
  public void close() {
    MDC.remove(TelemetryConstants.MDC_REQUEST_ID);
    MDC.remove(TelemetryConstants.MDC_SESSION_ID);
    if (backendSet) MDC.remove(TelemetryConstants.MDC_BACKEND);
  }
}
