package com.compareai.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One immutable entry of a session's conversation history.
 *
 * <p>{@code requestId} ties a user message to the fan-out it started and an assistant message to
 * the fan-out that produced it; {@code backendKey} is only set on assistant messages.
 */
public record Message(
    String id,
    Role role,
    String content,
    String sessionId,
    String requestId,
    String backendKey,
    Instant createdAt) {

  public Message {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(role, "role");
    content = content == null ? "" : content;
    createdAt = createdAt == null ? Instant.now() : createdAt;
  }

  public static Message user(String sessionId, String content, String requestId) {
    return new Message(UUID.randomUUID().toString(), Role.USER, content, sessionId, requestId, null, Instant.now());
  }

  public static Message assistant(String sessionId, String content, String requestId, String backendKey) {
    return new Message(UUID.randomUUID().toString(), Role.ASSISTANT, content, sessionId, requestId, backendKey, Instant.now());
  }

  public boolean isUser() {
    return role == Role.USER;
  }

  public boolean isAssistant() {
    return role == Role.ASSISTANT;
  }
}
