package com.compareai.services.tracking;

import com.compareai.core.model.BackendInfo;
import com.compareai.core.model.BackendMetadata;
import com.compareai.core.model.RequestSnapshot;
import com.compareai.core.model.RequestStatus;
import com.compareai.core.model.UserSession;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable state of one tracked request. Every method holds the record's monitor, so the completed
 * set size check and the status transition form a single serialized update.
 */
final class RequestRecord {
  private final String id;
  private final int totalBackends;
  private final Set<String> knownBackends;
  private final UserSession userInfo;
  private final List<BackendInfo> backendInfo;
  private final Instant createdAt;

  private final Set<String> completedBackends = new LinkedHashSet<>();
  private final Map<String, String> responses = new LinkedHashMap<>();
  private final Map<String, BackendMetadata> metadata = new LinkedHashMap<>();
  private final CompletableFuture<RequestSnapshot> completion = new CompletableFuture<>();

  private RequestStatus status = RequestStatus.PROCESSING;
  private Instant completionTime;

  RequestRecord(String id, int totalBackends, UserSession userInfo, List<BackendInfo> backendInfo, Instant createdAt) {
    this.id = id;
    this.totalBackends = totalBackends;
    this.userInfo = userInfo;
    this.backendInfo = List.copyOf(backendInfo);
    this.createdAt = createdAt;
    Set<String> keys = new LinkedHashSet<>();
    for (BackendInfo info : backendInfo) keys.add(info.key());
    this.knownBackends = Collections.unmodifiableSet(keys);
  }

  /**
   * Stores the result of one backend; a repeated key overwrites the previous result.
   *
   * @return true if this call moved the record to {@link RequestStatus#COMPLETED}
   */
  synchronized boolean complete(String backendKey, String response, BackendMetadata meta, Instant now) {
    if (!knownBackends.contains(backendKey)) {
      throw new IllegalArgumentException("Backend '%s' is not part of request %s".formatted(backendKey, id));
    }
    responses.put(backendKey, response);
    metadata.put(backendKey, meta);
    completedBackends.add(backendKey);
    if (status == RequestStatus.PROCESSING && completedBackends.size() == totalBackends) {
      status = RequestStatus.COMPLETED;
      completionTime = now;
      return true;
    }
    return false;
  }

  synchronized boolean isStale(Instant now, Duration retention) {
    return status == RequestStatus.COMPLETED
        && completionTime != null
        && Duration.between(completionTime, now).compareTo(retention) > 0;
  }

  synchronized RequestSnapshot snapshot() {
    return new RequestSnapshot(
        id,
        status,
        totalBackends,
        Collections.unmodifiableSet(new LinkedHashSet<>(completedBackends)),
        Collections.unmodifiableMap(new LinkedHashMap<>(responses)),
        Collections.unmodifiableMap(new LinkedHashMap<>(metadata)),
        userInfo,
        backendInfo,
        createdAt,
        completionTime);
  }

  CompletableFuture<RequestSnapshot> completion() {
    return completion;
  }
}
