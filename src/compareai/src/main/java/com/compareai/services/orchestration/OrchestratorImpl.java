package com.compareai.services.orchestration;

import com.compareai.core.api.Backend;
import com.compareai.core.model.AggregatedResult;
import com.compareai.core.model.BackendInfo;
import com.compareai.core.model.BackendMetadata;
import com.compareai.core.model.BackendResult;
import com.compareai.core.model.Message;
import com.compareai.core.model.RequestSnapshot;
import com.compareai.core.model.UserSession;
import com.compareai.exception.BackendException;
import com.compareai.exception.NotFoundException;
import com.compareai.exception.StateException;
import com.compareai.exception.ValidationException;
import com.compareai.services.context.ContextSelector;
import com.compareai.services.cost.CostEstimator;
import com.compareai.services.history.HistoryStore;
import com.compareai.services.telemetry.LogContext;
import com.compareai.services.telemetry.TelemetryService;
import com.compareai.services.tracking.RequestTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.compareai.services.telemetry.TelemetryConstants.ATTR_BACKEND;
import static com.compareai.services.telemetry.TelemetryConstants.ATTR_BACKEND_COUNT;
import static com.compareai.services.telemetry.TelemetryConstants.ATTR_SESSION_ID;

/**
 * OrchestratorImpl runs every request in three stages:
 * 1. On the caller thread: append the user message, snapshot the history, register the request
 * 2. On a pool sized to the request: one task per backend selects context, calls the adapter,
 *    estimates the cost and persists the answer; failures become error results
 * 3. On a coordinator thread: take results in completion order, record each one in the tracker
 *    and notify observers
 *
 * The coordinator is the only writer of a request's record, one result at a time.
 */
@Service
public class OrchestratorImpl implements Orchestrator, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(OrchestratorImpl.class);

  static final String ERROR_PREFIX = "Error generating response: ";

  private final HistoryStore historyStore;
  private final ContextSelector contextSelector;
  private final CostEstimator costEstimator;
  private final RequestTracker tracker;
  private final TelemetryService telemetry;
  private final OrchestrationProperties properties;
  private final List<CompletionObserver> observers = new CopyOnWriteArrayList<>();
  private final ExecutorService coordinator;

  @Autowired
  public OrchestratorImpl(HistoryStore historyStore,
                          ContextSelector contextSelector,
                          CostEstimator costEstimator,
                          RequestTracker tracker,
                          TelemetryService telemetry,
                          OrchestrationProperties properties) {
    this(historyStore, contextSelector, costEstimator, tracker, telemetry, properties,
        Executors.newCachedThreadPool(daemonThreads("orchestrator-coordinator")));
  }

  OrchestratorImpl(HistoryStore historyStore,
                   ContextSelector contextSelector,
                   CostEstimator costEstimator,
                   RequestTracker tracker,
                   TelemetryService telemetry,
                   OrchestrationProperties properties,
                   ExecutorService coordinator) {
    this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
    this.contextSelector = Objects.requireNonNull(contextSelector, "contextSelector");
    this.costEstimator = Objects.requireNonNull(costEstimator, "costEstimator");
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.coordinator = telemetry.propagating(Objects.requireNonNull(coordinator, "coordinator"));
  }

  @Override
  public String startProcessing(UserSession user, List<Backend> backends, String message) {
    Objects.requireNonNull(user, "user");
    if (message == null || message.isBlank()) {
      throw new ValidationException("Message must not be empty");
    }
    List<BackendInfo> infos = describe(backends);
    if (coordinator.isShutdown()) {
      throw new StateException("Orchestrator is shut down");
    }

    String requestId = UUID.randomUUID().toString();
    String sessionId = user.sessionId();
    try (var ignored = new LogContext(requestId, sessionId)) {
      Map<String, String> attrs = Map.of(
          ATTR_SESSION_ID, sessionId,
          ATTR_BACKEND_COUNT, String.valueOf(backends.size()));
      return telemetry.runRoot(requestId, "orchestrator.request", attrs, () -> {
        // Step 1: the user message is in history before any backend task exists
        historyStore.append(sessionId, Message.user(sessionId, message, requestId));
        List<Message> history = historyStore.getAll(sessionId);

        // Step 2: register the request
        tracker.create(requestId, backends.size(), user, infos);
        telemetry.countRequest(backends.size());

        // Step 3: one task per backend, collected in completion order
        ExecutorService workers = telemetry.propagating(
            Executors.newFixedThreadPool(backends.size(), daemonThreads("backend-" + requestId.substring(0, 8))));
        CompletionService<BackendResult> completions = new ExecutorCompletionService<>(workers);
        // the pool has one thread per backend, so a task starts when it is submitted
        Map<Future<BackendResult>, PendingTask> pending = new IdentityHashMap<>();
        for (Backend backend : backends) {
          long submitted = System.nanoTime();
          pending.put(completions.submit(() -> runBackend(requestId, sessionId, backend, history)),
              new PendingTask(backend, submitted));
        }
        try {
          coordinator.execute(() -> collect(requestId, sessionId, completions, pending, workers));
        } catch (RejectedExecutionException e) {
          workers.shutdownNow();
          tracker.remove(requestId);
          throw new StateException("Orchestrator is shut down, request " + requestId + " was not started", e);
        }

        logger.info("Started request across {} backends: {}", backends.size(),
            infos.stream().map(BackendInfo::key).toList());
        return requestId;
      });
    }
  }

  @Override
  public Optional<RequestSnapshot> getStatus(String requestId) {
    return tracker.get(requestId);
  }

  @Override
  public AggregatedResult waitForCompletion(String requestId, Duration maxWait, Duration pollInterval) {
    Objects.requireNonNull(maxWait, "maxWait");
    long pollMillis = Math.max(1L, pollInterval == null ? properties.getPollInterval().toMillis() : pollInterval.toMillis());
    long deadline = System.nanoTime() + maxWait.toNanos();

    while (true) {
      RequestSnapshot snapshot = getStatus(requestId)
          .orElseThrow(() -> new NotFoundException("Request not found: " + requestId, Map.of("requestId", String.valueOf(requestId))));
      if (snapshot.isCompleted()) {
        return AggregatedResult.from(snapshot, false);
      }
      long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      if (remainingMillis <= 0) {
        logger.warn("Request {} still waiting on {} of {} backends after {}", requestId,
            snapshot.totalBackends() - snapshot.completedBackends().size(), snapshot.totalBackends(), maxWait);
        return AggregatedResult.from(snapshot, true);
      }
      try {
        Thread.sleep(Math.min(pollMillis, remainingMillis));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return AggregatedResult.from(getStatus(requestId).orElse(snapshot), true);
      }
    }
  }

  @Override
  public AggregatedResult waitForCompletion(String requestId) {
    return waitForCompletion(requestId, properties.getMaxWait(), properties.getPollInterval());
  }

  @Override
  public Optional<CompletableFuture<RequestSnapshot>> completionOf(String requestId) {
    return tracker.completionOf(requestId);
  }

  @Override
  public void addCompletionObserver(CompletionObserver observer) {
    observers.add(Objects.requireNonNull(observer, "observer"));
  }

  @Override
  public void removeCompletionObserver(CompletionObserver observer) {
    observers.remove(observer);
  }

  @Override
  public void close() {
    coordinator.shutdownNow();
  }

  // ---------- Per-backend task ----------

  private BackendResult runBackend(String requestId, String sessionId, Backend backend, List<Message> history) {
    String key = backend.key();
    try (var ignored = new LogContext(requestId, sessionId, key)) {
      return telemetry.inSpan("orchestrator.backend", Map.of(ATTR_BACKEND, key), () -> {
        long start = System.nanoTime();
        telemetry.countBackendCall(key, backend.info().kind(), backend.adapter().model());
        String response;
        try {
          List<Message> context = contextSelector.select(history, requestId);
          if (context.isEmpty()) {
            context = lastUserMessage(history);
          }
          response = backend.adapter().respond(context);
          if (response == null) {
            throw new BackendException("Provider returned no text");
          }
        } catch (RuntimeException e) {
          logger.warn("Backend {} failed: {}", key, e.toString());
          return failure(backend, e, secondsSince(start));
        }

        double seconds = secondsSince(start);
        double cost = costEstimator.estimate(backend.info().pricing(), response);
        try {
          historyStore.append(sessionId, Message.assistant(sessionId, response, requestId, key));
        } catch (RuntimeException e) {
          logger.warn("Could not persist answer of backend {}", key, e);
        }
        return new BackendResult(key, response, new BackendMetadata(
            key, backend.info().displayName(), backend.adapter().model(), seconds, cost, false));
      });
    }
  }

  private static List<Message> lastUserMessage(List<Message> history) {
    for (int i = history.size() - 1; i >= 0; i--) {
      if (history.get(i).isUser()) return List.of(history.get(i));
    }
    return List.of();
  }

  private BackendResult failure(Backend backend, Throwable cause, double seconds) {
    telemetry.countBackendError(backend.key());
    String reason = cause == null ? "unknown error"
        : cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    return new BackendResult(backend.key(), ERROR_PREFIX + reason, new BackendMetadata(
        backend.key(), backend.info().displayName(), backend.adapter().model(), seconds, 0.0, true));
  }

  // ---------- Collection ----------

  private void collect(String requestId,
                       String sessionId,
                       CompletionService<BackendResult> completions,
                       Map<Future<BackendResult>, PendingTask> pending,
                       ExecutorService workers) {
    try (var ignored = new LogContext(requestId, sessionId)) {
      for (int remaining = pending.size(); remaining > 0; remaining--) {
        Future<BackendResult> done;
        try {
          done = completions.take();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          logger.warn("Stopped collecting results with {} backends outstanding", remaining);
          return;
        }
        PendingTask task = pending.get(done);
        try {
          record(requestId, resultOf(done, task));
        } catch (VirtualMachineError e) {
          throw e;
        } catch (Throwable e) {
          logger.error("Could not record result of backend {}", task.backend().key(), e);
        }
      }
    } finally {
      workers.shutdown();
    }
  }

  private void record(String requestId, BackendResult result) {
    boolean completed = tracker.recordCompletion(requestId, result.backendKey(), result.response(), result.metadata());
    logger.info("Backend {} finished in {}s (cost={} USD, error={})", result.backendKey(),
        result.metadata().processingTimeSeconds(), result.metadata().costUsd(), result.isError());
    notifyObservers(requestId, result);
    if (completed) {
      logger.info("Request completed");
    }
  }

  private BackendResult resultOf(Future<BackendResult> done, PendingTask task) {
    Backend backend = task.backend();
    try {
      return done.get();
    } catch (ExecutionException e) {
      logger.error("Backend task {} crashed", backend.key(), e.getCause());
      return failure(backend, e.getCause(), secondsSince(task.startNanos()));
    } catch (CancellationException e) {
      return failure(backend, e, secondsSince(task.startNanos()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return failure(backend, e, secondsSince(task.startNanos()));
    }
  }

  private void notifyObservers(String requestId, BackendResult result) {
    for (CompletionObserver observer : observers) {
      try {
        observer.onBackendCompleted(requestId, result.backendKey(), result);
      } catch (VirtualMachineError e) {
        throw e;
      } catch (Throwable e) {
        logger.warn("Completion observer {} failed for backend {}", observer, result.backendKey(), e);
      }
    }
  }

  // ---------- Helpers ----------

  private record PendingTask(Backend backend, long startNanos) {}

  private static List<BackendInfo> describe(List<Backend> backends) {
    if (backends == null || backends.isEmpty()) {
      throw new ValidationException("At least one backend is required");
    }
    Set<String> keys = new HashSet<>();
    List<BackendInfo> infos = new ArrayList<>(backends.size());
    for (Backend backend : backends) {
      if (!keys.add(backend.key())) {
        throw new ValidationException("Backend selected more than once: " + backend.key());
      }
      infos.add(backend.info());
    }
    return infos;
  }

  private static double secondsSince(long startNanos) {
    return Math.round((System.nanoTime() - startNanos) / 1_000_000.0) / 1000.0;
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger seq = new AtomicInteger();
    return runnable -> {
      Thread t = new Thread(runnable, prefix + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
