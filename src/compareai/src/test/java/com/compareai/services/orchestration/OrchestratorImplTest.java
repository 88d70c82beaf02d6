package com.compareai.services.orchestration;

import com.compareai.core.api.Backend;
import com.compareai.core.api.BackendAdapter;
import com.compareai.core.model.AggregatedResult;
import com.compareai.core.model.BackendInfo;
import com.compareai.core.model.BackendMetadata;
import com.compareai.core.model.Message;
import com.compareai.core.model.Pricing;
import com.compareai.core.model.RequestSnapshot;
import com.compareai.core.model.RequestStatus;
import com.compareai.core.model.UserSession;
import com.compareai.exception.NotFoundException;
import com.compareai.exception.StateException;
import com.compareai.exception.ValidationException;
import com.compareai.services.context.ContextSelectionProperties;
import com.compareai.services.context.ContextSelector;
import com.compareai.services.cost.CostEstimator;
import com.compareai.services.history.InMemoryHistoryStore;
import com.compareai.services.telemetry.TelemetryService;
import com.compareai.services.tracking.RequestTracker;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

/**
 * Exercises OrchestratorImpl end to end with in-memory collaborators and scripted backends.
 */
class OrchestratorImplTest {

  private static final Duration WAIT = Duration.ofSeconds(5);
  private static final Duration POLL = Duration.ofMillis(10);

  private final UserSession user = UserSession.of("s1", "Ana", "Comparison");

  private InMemoryHistoryStore history;
  private RequestTracker tracker;
  private OrchestratorImpl orchestrator;
  private final CountDownLatch release = new CountDownLatch(1);

  @BeforeEach
  void setUp() {
    history = new InMemoryHistoryStore();
    tracker = new RequestTracker();
    orchestrator = new OrchestratorImpl(
        history,
        new ContextSelector(new ContextSelectionProperties()),
        new CostEstimator(),
        tracker,
        new TelemetryService(OpenTelemetry.noop()),
        new OrchestrationProperties());
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    orchestrator.close();
  }

  private static Backend backend(String key, BackendAdapter adapter) {
    return new Backend(
        new BackendInfo(key, "test", "Backend " + key, null, "model-" + key, new Pricing(0.001, 0.002), true),
        adapter);
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private BackendAdapter blockingUntilReleased(String answer) {
    return context -> {
      try {
        release.await(10, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return answer;
    };
  }

  @Test
  @DisplayName("Every backend reports and the request completes")
  void allBackendsComplete() {
    List<Backend> backends = List.of(
        backend("a", context -> "answer from a"),
        backend("b", context -> "answer from b"),
        backend("c", context -> "x".repeat(4000)));

    String requestId = orchestrator.startProcessing(user, backends, "Hello");
    AggregatedResult result = orchestrator.waitForCompletion(requestId, WAIT, POLL);

    assertThat(result.timeout()).isFalse();
    assertThat(result.requestId()).isEqualTo(requestId);
    assertThat(result.responses()).containsOnlyKeys("a", "b", "c");
    assertThat(result.responses()).containsEntry("a", "answer from a");
    assertThat(result.metadata().values()).noneMatch(BackendMetadata::error);
    assertThat(result.metadata().get("c").costUsd()).isEqualTo(0.003);
    assertThat(result.metadata().get("a").displayName()).isEqualTo("Backend a");
    assertThat(result.metadata().get("a").processingTimeSeconds()).isGreaterThanOrEqualTo(0.0);
    assertThat(result.userInfo()).isEqualTo(user);
    assertThat(result.backendInfo()).extracting(BackendInfo::key).containsExactly("a", "b", "c");
  }

  @Test
  void failingBackendBecomesAnErrorResultWithoutAffectingOthers() {
    List<Backend> backends = List.of(
        backend("ok", context -> "fine"),
        backend("broken", context -> { throw new IllegalStateException("quota exceeded"); }),
        backend("silent", context -> null));

    String requestId = orchestrator.startProcessing(user, backends, "Hello");
    AggregatedResult result = orchestrator.waitForCompletion(requestId, WAIT, POLL);

    assertThat(result.timeout()).isFalse();
    assertThat(result.responses().get("ok")).isEqualTo("fine");
    assertThat(result.responses().get("broken")).isEqualTo(OrchestratorImpl.ERROR_PREFIX + "quota exceeded");
    assertThat(result.responses().get("silent")).startsWith(OrchestratorImpl.ERROR_PREFIX);

    BackendMetadata broken = result.metadata().get("broken");
    assertThat(broken.error()).isTrue();
    assertThat(broken.costUsd()).isZero();
    assertThat(result.metadata().get("ok").error()).isFalse();
  }

  @Test
  @DisplayName("A fast backend's answer is visible while a slow one is still running")
  void progressiveVisibility() throws Exception {
    CountDownLatch fastRecorded = new CountDownLatch(1);
    orchestrator.addCompletionObserver((id, key, result) -> {
      if (key.equals("fast")) fastRecorded.countDown();
    });

    String requestId = orchestrator.startProcessing(user, List.of(
        backend("fast", context -> "quick"),
        backend("slow", blockingUntilReleased("eventually"))), "Hello");

    assertThat(fastRecorded.await(5, TimeUnit.SECONDS)).isTrue();
    RequestSnapshot partial = orchestrator.getStatus(requestId).orElseThrow();
    assertThat(partial.status()).isEqualTo(RequestStatus.PROCESSING);
    assertThat(partial.completedBackends()).containsExactly("fast");
    assertThat(partial.responses()).containsEntry("fast", "quick").doesNotContainKey("slow");

    release.countDown();
    AggregatedResult result = orchestrator.waitForCompletion(requestId, WAIT, POLL);
    assertThat(result.timeout()).isFalse();
    assertThat(result.responses()).containsEntry("slow", "eventually");
  }

  @Test
  void observersSeeEveryResultEvenIfOneOfThemFails() throws Exception {
    List<String> seen = new CopyOnWriteArrayList<>();
    CountDownLatch both = new CountDownLatch(2);
    orchestrator.addCompletionObserver((id, key, result) -> { throw new RuntimeException("observer bug"); });
    orchestrator.addCompletionObserver((id, key, result) -> {
      seen.add(key);
      both.countDown();
    });

    String requestId = orchestrator.startProcessing(user, List.of(
        backend("a", context -> "1"),
        backend("b", context -> { throw new RuntimeException("down"); })), "Hello");

    assertThat(both.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(seen).containsExactlyInAnyOrder("a", "b");
    assertThat(orchestrator.waitForCompletion(requestId, WAIT, POLL).timeout()).isFalse();
  }

  @Test
  @DisplayName("An observer throwing an Error does not stop later results from being recorded")
  void observerErrorDoesNotStopCollection() {
    orchestrator.addCompletionObserver((id, key, result) -> { throw new AssertionError("observer blew up"); });

    String requestId = orchestrator.startProcessing(user, List.of(
        backend("a", context -> "fast"),
        backend("b", context -> {
          sleep(200);
          return "slow";
        })), "Hello");

    AggregatedResult result = orchestrator.waitForCompletion(requestId, WAIT, POLL);
    assertThat(result.timeout()).isFalse();
    assertThat(result.responses()).containsEntry("a", "fast").containsEntry("b", "slow");
  }

  @Test
  void crashedTaskReportsItsElapsedTime() {
    String requestId = orchestrator.startProcessing(user, List.of(
        backend("crash", context -> {
          sleep(150);
          throw new AssertionError("adapter bug");
        })), "Hello");

    AggregatedResult result = orchestrator.waitForCompletion(requestId, WAIT, POLL);

    assertThat(result.responses().get("crash")).isEqualTo(OrchestratorImpl.ERROR_PREFIX + "adapter bug");
    BackendMetadata meta = result.metadata().get("crash");
    assertThat(meta.error()).isTrue();
    assertThat(meta.processingTimeSeconds()).isGreaterThanOrEqualTo(0.1);
  }

  @Test
  void startAfterCloseIsRejectedWithoutSideEffects() {
    orchestrator.close();

    assertThatThrownBy(() -> orchestrator.startProcessing(user, List.of(backend("a", context -> "x")), "Hello"))
        .isInstanceOf(StateException.class);
    assertThat(tracker.size()).isZero();
    assertThat(history.getAll("s1")).isEmpty();
  }

  @Test
  void requestIsDroppedWhenCollectorCannotBeScheduled() {
    ExecutorService rejecting = mock(ExecutorService.class);
    doThrow(new RejectedExecutionException("saturated")).when(rejecting).execute(any(Runnable.class));
    OrchestratorImpl rejected = new OrchestratorImpl(
        history,
        new ContextSelector(new ContextSelectionProperties()),
        new CostEstimator(),
        tracker,
        new TelemetryService(OpenTelemetry.noop()),
        new OrchestrationProperties(),
        rejecting);

    assertThatThrownBy(() -> rejected.startProcessing(user, List.of(backend("a", context -> "x")), "Hello"))
        .isInstanceOf(StateException.class)
        .hasCauseInstanceOf(RejectedExecutionException.class);
    assertThat(tracker.size()).isZero();
  }

  @Test
  void removedObserverIsNotNotified() {
    List<String> seen = new CopyOnWriteArrayList<>();
    CompletionObserver observer = (id, key, result) -> seen.add(key);
    orchestrator.addCompletionObserver(observer);
    orchestrator.removeCompletionObserver(observer);

    String requestId = orchestrator.startProcessing(user, List.of(backend("a", context -> "1")), "Hello");
    orchestrator.waitForCompletion(requestId, WAIT, POLL);

    assertThat(seen).isEmpty();
  }

  @Test
  @DisplayName("Waiting past the limit returns the partial result and late answers still land")
  void timeoutReturnsPartialResult() throws Exception {
    String requestId = orchestrator.startProcessing(user, List.of(
        backend("fast", context -> "quick"),
        backend("slow", blockingUntilReleased("late"))), "Hello");

    AggregatedResult partial = orchestrator.waitForCompletion(requestId, Duration.ofMillis(300), POLL);

    assertThat(partial.timeout()).isTrue();
    assertThat(partial.responses()).containsEntry("fast", "quick").doesNotContainKey("slow");

    release.countDown();
    RequestSnapshot done = orchestrator.completionOf(requestId).orElseThrow().get(5, TimeUnit.SECONDS);
    assertThat(done.isCompleted()).isTrue();
    assertThat(done.responses()).containsEntry("slow", "late");
  }

  @Test
  void unknownRequest() {
    assertThat(orchestrator.getStatus("nope")).isEmpty();
    assertThat(orchestrator.completionOf("nope")).isEmpty();
    assertThatThrownBy(() -> orchestrator.waitForCompletion("nope", WAIT, POLL))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void historyHoldsTheQuestionAndEverySuccessfulAnswer() {
    String requestId = orchestrator.startProcessing(user, List.of(
        backend("a", context -> "from a"),
        backend("b", context -> "from b"),
        backend("bad", context -> { throw new RuntimeException("no"); })), "What is Java?");
    orchestrator.waitForCompletion(requestId, WAIT, POLL);

    List<Message> messages = history.getAll("s1");
    assertThat(messages).hasSize(3);
    assertThat(messages.get(0).isUser()).isTrue();
    assertThat(messages.get(0).content()).isEqualTo("What is Java?");
    assertThat(messages).allMatch(m -> requestId.equals(m.requestId()));
    assertThat(messages.subList(1, 3)).extracting(Message::backendKey).containsExactlyInAnyOrder("a", "b");
  }

  @Test
  @DisplayName("Backends get the name introduction but not questions answered by earlier requests")
  void contextCarriesIntroductionAcrossRequests() {
    List<List<Message>> contexts = new CopyOnWriteArrayList<>();
    Backend recording = backend("rec", context -> {
      contexts.add(context);
      return "ok";
    });

    String first = orchestrator.startProcessing(user, List.of(recording), "Hi, my name is Ana");
    orchestrator.waitForCompletion(first, WAIT, POLL);
    String second = orchestrator.startProcessing(user, List.of(recording), "What's the capital of France?");
    orchestrator.waitForCompletion(second, WAIT, POLL);
    String third = orchestrator.startProcessing(user, List.of(recording), "What is my name?");
    orchestrator.waitForCompletion(third, WAIT, POLL);

    assertThat(contexts).hasSize(3);
    assertThat(contexts.get(0)).extracting(Message::content).containsExactly("Hi, my name is Ana");
    assertThat(contexts.get(2)).extracting(Message::content)
        .containsExactly("Hi, my name is Ana", "What is my name?");
  }

  @Test
  void processMessageBlocksUntilDone() {
    AggregatedResult result = orchestrator.processMessage(user, List.of(backend("a", context -> "done")), "Hello");

    assertThat(result.timeout()).isFalse();
    assertThat(result.responses()).containsEntry("a", "done");
  }

  @Test
  void rejectsInvalidInputBeforeTouchingHistory() {
    Backend a = backend("a", context -> "x");

    assertThatThrownBy(() -> orchestrator.startProcessing(user, List.of(), "Hello"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> orchestrator.startProcessing(user, List.of(a, a), "Hello"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> orchestrator.startProcessing(user, List.of(a), "   "))
        .isInstanceOf(ValidationException.class);

    assertThat(history.getAll("s1")).isEmpty();
    assertThat(tracker.size()).isZero();
  }
}
