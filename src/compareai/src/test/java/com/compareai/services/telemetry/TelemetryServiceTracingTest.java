package com.compareai.services.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.compareai.services.telemetry.TelemetryConstants.ATTR_BACKEND;
import static com.compareai.services.telemetry.TelemetryConstants.ATTR_REQUEST_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelemetryServiceTracingTest {
  private InMemorySpanExporter spanExporter;
  private SdkTracerProvider tracerProvider;
  private TelemetryService telemetryService;

  @BeforeEach
  void setUp() {
    spanExporter = InMemorySpanExporter.create();
    tracerProvider = SdkTracerProvider.builder()
        .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
        .setResource(Resource.getDefault())
        .build();
    telemetryService = new TelemetryService(OpenTelemetrySdk.builder().setTracerProvider(tracerProvider).build());
  }

  @AfterEach
  void tearDown() {
    tracerProvider.close();
  }

  private SpanData span(String name) {
    return spanExporter.getFinishedSpanItems().stream()
        .filter(s -> s.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("span not exported: " + name));
  }

  @Test
  void runRoot_createsServerSpan_withRequestId() {
    String result = telemetryService.runRoot("req-1", "orchestrator.request", Map.of("foo", "bar"), () -> "ok");

    assertThat(result).isEqualTo("ok");
    SpanData root = span("orchestrator.request");
    assertThat(root.getKind()).isEqualTo(SpanKind.SERVER);
    assertThat(root.getAttributes().get(AttributeKey.stringKey(ATTR_REQUEST_ID))).isEqualTo("req-1");
    assertThat(root.getAttributes().get(AttributeKey.stringKey("foo"))).isEqualTo("bar");
  }

  @Test
  void inSpan_onWorkerThread_isChildOfRootAndCarriesRequestId() throws Exception {
    ExecutorService executor = telemetryService.propagating(Executors.newSingleThreadExecutor());
    try {
      telemetryService.runRoot("req-2", "orchestrator.request", Map.of(), () -> {
        try {
          return executor.submit(() -> telemetryService.inSpan("orchestrator.backend", Map.of(ATTR_BACKEND, "openai"), () -> "done"))
              .get(5, TimeUnit.SECONDS);
        } catch (Exception e) {
          throw new IllegalStateException(e);
        }
      });
    } finally {
      executor.shutdownNow();
    }

    SpanData root = span("orchestrator.request");
    SpanData child = span("orchestrator.backend");
    assertThat(child.getKind()).isEqualTo(SpanKind.INTERNAL);
    assertThat(child.getTraceId()).isEqualTo(root.getTraceId());
    assertThat(child.getParentSpanId()).isEqualTo(root.getSpanId());
    assertThat(child.getAttributes().get(AttributeKey.stringKey(ATTR_REQUEST_ID))).isEqualTo("req-2");
    assertThat(child.getAttributes().get(AttributeKey.stringKey(ATTR_BACKEND))).isEqualTo("openai");
  }

  @Test
  void inSpan_recordsExceptionAndRethrows() {
    assertThatThrownBy(() -> telemetryService.inSpan("failing", Map.of(), () -> { throw new IllegalStateException("boom"); }))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("boom");

    SpanData failing = span("failing");
    assertThat(failing.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    assertThat(failing.getEvents()).anySatisfy(event -> assertThat(event.getName()).isEqualTo("exception"));
  }

  @Test
  void inSpan_outsideARequest_hasNoRequestId() {
    telemetryService.inSpan("standalone", Map.of(), () -> "ok");

    assertThat(span("standalone").getAttributes().get(AttributeKey.stringKey(ATTR_REQUEST_ID))).isNull();
  }
}
