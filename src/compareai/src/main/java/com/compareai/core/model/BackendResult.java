package com.compareai.core.model;

/** Outcome of one backend for one request. On failure {@code response} holds the error text. */
public record BackendResult(String backendKey, String response, BackendMetadata metadata) {
  public boolean isError() {
    return metadata != null && metadata.error();
  }
}
