package com.compareai.core.model;

/**
 * Descriptive data of one configured backend, as shown to clients and stored alongside a request.
 *
 * @param key stable identifier used as the key of responses and metadata
 * @param kind provider family (openai, anthropic, ...)
 * @param available false when the adapter could not be built from configuration
 */
public record BackendInfo(
    String key,
    String kind,
    String displayName,
    String description,
    String model,
    Pricing pricing,
    boolean available) {

  public BackendInfo {
    pricing = pricing == null ? Pricing.FREE : pricing;
    displayName = displayName == null || displayName.isBlank() ? key : displayName;
  }
}
