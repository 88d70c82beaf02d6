package com.compareai.services.tracking;

import com.compareai.core.model.BackendInfo;
import com.compareai.core.model.BackendMetadata;
import com.compareai.core.model.RequestSnapshot;
import com.compareai.core.model.UserSession;
import com.compareai.exception.AlreadyExistsException;
import com.compareai.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide, in-memory store of fan-out requests keyed by request id.
 *
 * <p>Records stay while processing and for {@code retention} after completion. Expiry is
 * cooperative: stale records are dropped when they are read or when a new request is created.
 * Safe for any interleaving of callers working on the same or different requests.
 */
public class RequestTracker {
  private static final Logger logger = LoggerFactory.getLogger(RequestTracker.class);

  public static final Duration DEFAULT_RETENTION = Duration.ofSeconds(300);

  private final ConcurrentMap<String, RequestRecord> records = new ConcurrentHashMap<>();
  private final Duration retention;
  private final Clock clock;

  public RequestTracker() {
    this(DEFAULT_RETENTION, Clock.systemUTC());
  }

  public RequestTracker(Duration retention, Clock clock) {
    this.retention = Objects.requireNonNull(retention, "retention");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Registers a new request in the processing state.
   *
   * @param backendInfo one entry per backend; its keys are the only keys the record accepts
   * @throws ValidationException when the backend list is empty, has duplicates or does not match
   *     {@code totalBackends}
   * @throws AlreadyExistsException when the id is already tracked
   */
  public void create(String id, int totalBackends, UserSession userInfo, List<BackendInfo> backendInfo) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(backendInfo, "backendInfo");
    if (totalBackends <= 0) {
      throw new ValidationException("A request needs at least one backend");
    }
    if (backendInfo.size() != totalBackends) {
      throw new ValidationException("Expected %d backends, got %d".formatted(totalBackends, backendInfo.size()));
    }
    Set<String> keys = new HashSet<>();
    for (BackendInfo info : backendInfo) {
      if (!keys.add(info.key())) {
        throw new ValidationException("Duplicate backend key: " + info.key());
      }
    }
    purgeExpired();
    RequestRecord record = new RequestRecord(id, totalBackends, userInfo, backendInfo, clock.instant());
    if (records.putIfAbsent(id, record) != null) {
      throw new AlreadyExistsException("Request already tracked: " + id);
    }
  }

  /**
   * Stores one backend's outcome. Repeating a key overwrites the earlier outcome. When the last
   * outstanding backend reports, the request becomes completed; that transition happens once.
   *
   * @return true if this call completed the request; false otherwise, including for unknown ids
   */
  public boolean recordCompletion(String id, String backendKey, String response, BackendMetadata metadata) {
    RequestRecord record = records.get(id);
    if (record == null) {
      logger.warn("Dropping result of backend {} for unknown request {}", backendKey, id);
      return false;
    }
    boolean completed = record.complete(backendKey, response, metadata, clock.instant());
    if (completed) {
      record.completion().complete(record.snapshot());
    }
    return completed;
  }

  /** Returns a snapshot of the request, after dropping it if it is stale. */
  public Optional<RequestSnapshot> get(String id) {
    if (id == null) return Optional.empty();
    expireIfStale(id);
    RequestRecord record = records.get(id);
    return record == null ? Optional.empty() : Optional.of(record.snapshot());
  }

  /** Future completed with the final snapshot once every backend has reported. */
  public Optional<CompletableFuture<RequestSnapshot>> completionOf(String id) {
    if (id == null) return Optional.empty();
    RequestRecord record = records.get(id);
    return record == null ? Optional.empty() : Optional.of(record.completion().copy());
  }

  /** Forgets a request regardless of its state; used when a request could not be started. */
  public boolean remove(String id) {
    return id != null && records.remove(id) != null;
  }

  /** Removes the record if it completed more than the retention period ago. */
  public void expireIfStale(String id) {
    Instant now = clock.instant();
    records.computeIfPresent(id, (k, record) -> {
      if (record.isStale(now, retention)) {
        logger.debug("Expiring completed request {}", k);
        return null;
      }
      return record;
    });
  }

  /** Drops every stale record. */
  public void purgeExpired() {
    Instant now = clock.instant();
    records.values().removeIf(record -> record.isStale(now, retention));
  }

  public int size() {
    return records.size();
  }

  public Duration retention() {
    return retention;
  }
}
