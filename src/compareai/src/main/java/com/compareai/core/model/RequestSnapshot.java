package com.compareai.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time, immutable copy of a tracked request. Collections are copies, later completions do
 * not show up in an existing snapshot.
 */
public record RequestSnapshot(
    String id,
    RequestStatus status,
    int totalBackends,
    Set<String> completedBackends,
    Map<String, String> responses,
    Map<String, BackendMetadata> metadata,
    UserSession userInfo,
    List<BackendInfo> backendInfo,
    Instant createdAt,
    Instant completionTime) {

  public boolean isCompleted() {
    return status == RequestStatus.COMPLETED;
  }
}
