package com.compareai.services.telemetry;

/**
 * Centralized telemetry constants for tracer/meter names, MDC keys and attribute keys.
 */
public final class TelemetryConstants {
  private TelemetryConstants() {}

  /** Tracer name used for manual spans. */
  public static final String TRACER = "com.compareai.orchestrator";
  /** Meter name used for custom application metrics. */
  public static final String METER  = "com.compareai.orchestrator";

  /** MDC keys propagated into every log line of a request. */
  public static final String MDC_REQUEST_ID = "requestId";
  public static final String MDC_SESSION_ID = "sessionId";
  public static final String MDC_BACKEND    = "backend";

  /** Attribute keys used across spans/metrics. */
  public static final String ATTR_REQUEST_ID    = "compareai.request.id";
  public static final String ATTR_SESSION_ID    = "compareai.session.id";
  public static final String ATTR_BACKEND       = "compareai.backend.key";
  public static final String ATTR_PROVIDER      = "compareai.backend.provider";
  public static final String ATTR_MODEL         = "compareai.backend.model";
  public static final String ATTR_BACKEND_COUNT = "compareai.request.backends";
}
