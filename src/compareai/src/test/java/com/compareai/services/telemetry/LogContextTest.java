package com.compareai.services.telemetry;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static com.compareai.services.telemetry.TelemetryConstants.MDC_BACKEND;
import static com.compareai.services.telemetry.TelemetryConstants.MDC_REQUEST_ID;
import static com.compareai.services.telemetry.TelemetryConstants.MDC_SESSION_ID;
import static org.assertj.core.api.Assertions.assertThat;

class LogContextTest {

  @Test
  void putsAndRemovesRequestKeysInMdc() {
    MDC.clear();
    try (var ctx = new LogContext("req-1", "sess-1", "openai")) {
      assertThat(MDC.get(MDC_REQUEST_ID)).isEqualTo("req-1");
      assertThat(MDC.get(MDC_SESSION_ID)).isEqualTo("sess-1");
      assertThat(MDC.get(MDC_BACKEND)).isEqualTo("openai");
    }
    assertThat(MDC.get(MDC_REQUEST_ID)).isNull();
    assertThat(MDC.get(MDC_SESSION_ID)).isNull();
    assertThat(MDC.get(MDC_BACKEND)).isNull();
  }

  @Test
  void backendKeyOfAnOuterScopeSurvivesAnInnerScopeWithoutOne() {
    MDC.clear();
    MDC.put(MDC_BACKEND, "outer");
    try (var ctx = new LogContext("req-1", null)) {
      assertThat(MDC.get(MDC_SESSION_ID)).isNull();
    }
    assertThat(MDC.get(MDC_BACKEND)).isEqualTo("outer");
    MDC.clear();
  }
}
