package com.compareai.services.orchestration;

import com.compareai.core.api.Backend;
import com.compareai.core.model.AggregatedResult;
import com.compareai.core.model.RequestSnapshot;
import com.compareai.core.model.UserSession;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Orchestrator fans one user message out to several backends and tracks their answers:
 * - Appends the user message to the session history before any backend runs
 * - Runs one independent task per backend; a failing backend yields an error result for its key
 * - Records each result as soon as it arrives and notifies completion observers
 * - Marks the request completed once every backend has reported
 *
 * Implementations MUST be thread-safe.
 */
public interface Orchestrator {

  /**
   * Schedule the fan-out and return without waiting for any backend.
   *
   * @param user session the message belongs to
   * @param backends distinct backends to ask, at least one
   * @param message the user's message
   * @return id of the new request, to be polled with {@link #getStatus(String)}
   * @throws com.compareai.exception.StateException once the orchestrator has been shut down
   */
  String startProcessing(UserSession user, List<Backend> backends, String message);

  /**
   * Current state of a request; empty when the id is unknown or the request expired.
   */
  Optional<RequestSnapshot> getStatus(String requestId);

  /**
   * Poll {@link #getStatus(String)} until the request completes or {@code maxWait} elapses. On
   * timeout the partial result is returned with {@code timeout=true}; running backends are not
   * cancelled and keep recording their results.
   *
   * @throws com.compareai.exception.NotFoundException when the request is unknown
   */
  AggregatedResult waitForCompletion(String requestId, Duration maxWait, Duration pollInterval);

  /** {@link #waitForCompletion(String, Duration, Duration)} with the configured defaults. */
  AggregatedResult waitForCompletion(String requestId);

  /** Start a request and block until it completes or the default wait elapses. */
  default AggregatedResult processMessage(UserSession user, List<Backend> backends, String message) {
    return waitForCompletion(startProcessing(user, backends, message));
  }

  /**
   * Push-style alternative to polling: a future completed with the final snapshot.
   */
  Optional<CompletableFuture<RequestSnapshot>> completionOf(String requestId);

  void addCompletionObserver(CompletionObserver observer);

  void removeCompletionObserver(CompletionObserver observer);
}
