package com.compareai.services.orchestration;

import com.compareai.services.tracking.RequestTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the process-wide request store used by the orchestrator.
 */
@Configuration
public class OrchestrationConfig {
  private static final Logger logger = LoggerFactory.getLogger(OrchestrationConfig.class);

  @Bean
  public RequestTracker requestTracker(OrchestrationProperties properties) {
    logger.info("Initializing RequestTracker (retention={})", properties.getRetention());
    return new RequestTracker(properties.getRetention(), Clock.systemUTC());
  }
}
