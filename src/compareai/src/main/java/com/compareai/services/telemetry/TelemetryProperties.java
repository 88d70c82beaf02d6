package com.compareai.services.telemetry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * otel:
 *   enabled: true                       # false swaps the SDK for the no-op implementation
 *   service-name: compareai
 *   endpoint: http://localhost:4317     # OTLP gRPC collector
 *   metric-export-interval: 60s
 *   trace-sample-ratio: 1.0             # applied to root spans, children follow their parent
 */
@Component
@ConfigurationProperties(prefix = "otel")
public class TelemetryProperties {
  private boolean enabled = true;
  private String serviceName = "compareai";
  private String endpoint = "http://localhost:4317";
  private Duration metricExportInterval = Duration.ofSeconds(60);
  private double traceSampleRatio = 1.0;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getServiceName() {
    return serviceName;
  }

  public void setServiceName(String serviceName) {
    this.serviceName = serviceName;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public void setEndpoint(String endpoint) {
    this.endpoint = endpoint;
  }

  public Duration getMetricExportInterval() {
    return metricExportInterval;
  }

  public void setMetricExportInterval(Duration metricExportInterval) {
    this.metricExportInterval = metricExportInterval;
  }

  public double getTraceSampleRatio() {
    return traceSampleRatio;
  }

  public void setTraceSampleRatio(double traceSampleRatio) {
    this.traceSampleRatio = traceSampleRatio;
  }
}
