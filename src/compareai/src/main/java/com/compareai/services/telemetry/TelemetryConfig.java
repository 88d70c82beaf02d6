package com.compareai.services.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link OpenTelemetry} instance the orchestrator reports to.
 *
 * <p>With {@code otel.enabled=true} (the default) spans and the request/backend counters leave the
 * process over OTLP gRPC; the SDK is closed with the application context, which flushes pending
 * batches. With {@code otel.enabled=false} the no-op implementation is used and nothing is
 * exported.
 */
@Configuration
public class TelemetryConfig {
  private static final Logger logger = LoggerFactory.getLogger(TelemetryConfig.class);

  @Bean
  public OpenTelemetry openTelemetry(TelemetryProperties properties) {
    if (!properties.isEnabled()) {
      logger.info("Telemetry export disabled");
      return OpenTelemetry.noop();
    }
    logger.info("Exporting telemetry of '{}' to {}", properties.getServiceName(), properties.getEndpoint());
    return buildSdk(properties);
  }

  static OpenTelemetrySdk buildSdk(TelemetryProperties properties) {
    Resource resource = resource(properties.getServiceName());

    SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
        .setResource(resource)
        .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(clampRatio(properties.getTraceSampleRatio()))))
        .addSpanProcessor(BatchSpanProcessor.builder(
            OtlpGrpcSpanExporter.builder().setEndpoint(properties.getEndpoint()).build()).build())
        .build();

    SdkMeterProvider meterProvider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(PeriodicMetricReader.builder(
                OtlpGrpcMetricExporter.builder().setEndpoint(properties.getEndpoint()).build())
            .setInterval(properties.getMetricExportInterval())
            .build())
        .build();

    return OpenTelemetrySdk.builder()
        .setTracerProvider(tracerProvider)
        .setMeterProvider(meterProvider)
        .build();
  }

  static Resource resource(String serviceName) {
    String name = serviceName == null || serviceName.isBlank() ? "compareai" : serviceName;
    return Resource.getDefault().merge(Resource.create(Attributes.builder()
        .put("service.name", name)
        .put("service.version", System.getenv().getOrDefault("BUILD_VERSION", "dev"))
        .build()));
  }

  static double clampRatio(double ratio) {
    if (Double.isNaN(ratio)) return 1.0;
    return Math.max(0.0, Math.min(1.0, ratio));
  }
}
