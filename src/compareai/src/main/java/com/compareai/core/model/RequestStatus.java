package com.compareai.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RequestStatus {
  PROCESSING,
  COMPLETED;

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
