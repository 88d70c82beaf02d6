package com.compareai.core.model;

import java.time.Instant;
import java.util.Objects;

/** The person behind a chat session and the project they are comparing backends for. */
public record UserSession(String sessionId, String name, String projectTitle, Instant createdAt) {
  public UserSession {
    Objects.requireNonNull(sessionId, "sessionId");
    createdAt = createdAt == null ? Instant.now() : createdAt;
  }

  public static UserSession of(String sessionId, String name, String projectTitle) {
    return new UserSession(sessionId, name, projectTitle, Instant.now());
  }
}
