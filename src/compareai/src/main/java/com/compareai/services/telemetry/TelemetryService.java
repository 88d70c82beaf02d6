package com.compareai.services.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.baggage.Baggage;
import io.opentelemetry.api.baggage.BaggageEntryMetadata;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

import static com.compareai.services.telemetry.TelemetryConstants.*;

/**
 * Thin facade over OpenTelemetry used by the orchestrator: one root span per fan-out request,
 * child spans per backend task, and request/backend counters.
 */
@Component
public class TelemetryService {
  private final Tracer tracer;
  private final LongCounter requestsTotal;
  private final LongCounter backendCallsTotal;
  private final LongCounter backendErrorsTotal;

  private static final String BAGGAGE_REQUEST_ID = ATTR_REQUEST_ID;

  public TelemetryService(OpenTelemetry openTelemetry) {
    this.tracer = openTelemetry.getTracer(TRACER);
    Meter meter = openTelemetry.meterBuilder(METER).build();
    this.requestsTotal = meter
        .counterBuilder("com.compareai.requests.total")
        .setDescription("Fan-out requests accepted")
        .build();
    this.backendCallsTotal = meter
        .counterBuilder("com.compareai.backend.calls.total")
        .setDescription("Backend calls executed")
        .build();
    this.backendErrorsTotal = meter
        .counterBuilder("com.compareai.backend.errors.total")
        .setDescription("Backend calls that ended with an error result")
        .build();
  }

  // ------------ Tracing ------------

  /**
   * Runs {@code body} inside a new root span carrying the request id, which is also placed in the
   * baggage so that child spans and metrics recorded on other threads can pick it up.
   */
  public <T> T runRoot(String requestId, String name, Map<String, String> attrs, Supplier<T> body) {
    Objects.requireNonNull(name, "span name");
    Objects.requireNonNull(body, "body");

    SpanBuilder spanBuilder = tracer.spanBuilder(name)
        .setSpanKind(SpanKind.SERVER)
        .setNoParent();
    if (requestId != null) spanBuilder.setAttribute(ATTR_REQUEST_ID, requestId);
    applyAttributes(spanBuilder, attrs);

    Span span = spanBuilder.startSpan();
    try (Scope spanScope = span.makeCurrent();
         Scope baggageScope = makeRequestBaggageCurrent(requestId)) {
      return body.get();
    } catch (RuntimeException e) {
      span.recordException(e);
      span.setStatus(StatusCode.ERROR);
      throw e;
    } finally {
      span.end();
    }
  }

  public <T> T inSpan(String name, Map<String, String> attrs, Supplier<T> body) {
    Objects.requireNonNull(name, "span name");
    Objects.requireNonNull(body, "body");

    SpanBuilder spanBuilder = tracer.spanBuilder(name).setSpanKind(SpanKind.INTERNAL);
    String requestId = getRequestIdFromContext();
    if (requestId != null) {
      spanBuilder.setAttribute(ATTR_REQUEST_ID, requestId);
    }
    applyAttributes(spanBuilder, attrs);

    Span span = spanBuilder.startSpan();
    try (Scope ignored = span.makeCurrent()) {
      return body.get();
    } catch (RuntimeException e) {
      span.recordException(e);
      span.setStatus(StatusCode.ERROR);
      throw e;
    } finally {
      span.end();
    }
  }

  /**
   * Wraps an executor so that tasks submitted from inside a span run with that span (and its
   * baggage) as their current context.
   */
  public ExecutorService propagating(ExecutorService executor) {
    return Context.taskWrapping(executor);
  }

  // ------------ Metrics ------------

  public void countRequest(int backendCount) {
    requestsTotal.add(1, metricAttributes(Map.of(
        ATTR_BACKEND_COUNT, String.valueOf(backendCount)
    )));
  }

  public void countBackendCall(String backendKey, String provider, String model) {
    Map<String, String> attrs = new HashMap<>();
    attrs.put(ATTR_BACKEND, backendKey);
    attrs.put(ATTR_PROVIDER, provider);
    attrs.put(ATTR_MODEL, model);
    backendCallsTotal.add(1, metricAttributes(attrs));
  }

  public void countBackendError(String backendKey) {
    backendErrorsTotal.add(1, metricAttributes(Map.of(
        ATTR_BACKEND, backendKey
    )));
  }

  // ------------ Internal helpers ------------

  private static void applyAttributes(SpanBuilder spanBuilder, Map<String, String> attrs) {
    if (attrs != null) {
      attrs.forEach((k, v) -> {
        if (k != null && v != null) {
          spanBuilder.setAttribute(AttributeKey.stringKey(k), v);
        }
      });
    }
  }

  private static Scope makeRequestBaggageCurrent(String requestId) {
    if (requestId != null) {
      Baggage baggage = Baggage.current().toBuilder()
          .put(BAGGAGE_REQUEST_ID, requestId, BaggageEntryMetadata.empty())
          .build();
      return baggage.makeCurrent();
    }
    return () -> {}; // no-op scope
  }

  private static String getRequestIdFromContext() {
    String value = Baggage.current().getEntryValue(BAGGAGE_REQUEST_ID);
    return (value == null || value.isEmpty()) ? null : value;
  }

  /**
   * Build metric attributes. The request id stays on spans only: one value per request would give
   * every request its own time series.
   */
  private static Attributes metricAttributes(Map<String, String> attrs) {
    AttributesBuilder builder = Attributes.builder();
    if (attrs != null) {
      attrs.forEach((k, v) -> { if (k != null && v != null) builder.put(AttributeKey.stringKey(k), v); });
    }
    return builder.build();
  }
}
