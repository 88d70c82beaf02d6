package com.compareai.services.orchestration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * orchestration:
 *   retention: 300s       # how long a completed request stays visible to pollers
 *   max-wait: 60s         # default limit of the blocking wait
 *   poll-interval: 500ms  # default polling step of the blocking wait
 */
@Component
@ConfigurationProperties(prefix = "orchestration")
public class OrchestrationProperties {
  private Duration retention = Duration.ofSeconds(300);
  private Duration maxWait = Duration.ofSeconds(60);
  private Duration pollInterval = Duration.ofMillis(500);

  public Duration getRetention() {
    return retention;
  }

  public void setRetention(Duration retention) {
    this.retention = retention;
  }

  public Duration getMaxWait() {
    return maxWait;
  }

  public void setMaxWait(Duration maxWait) {
    this.maxWait = maxWait;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }
}
