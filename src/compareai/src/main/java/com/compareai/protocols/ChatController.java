package com.compareai.protocols;

import com.compareai.core.api.Backend;
import com.compareai.core.model.AggregatedResult;
import com.compareai.core.model.BackendInfo;
import com.compareai.core.model.Message;
import com.compareai.core.model.RequestSnapshot;
import com.compareai.core.model.UserSession;
import com.compareai.exception.NotFoundException;
import com.compareai.services.backend.BackendRegistry;
import com.compareai.services.history.HistoryStore;
import com.compareai.services.orchestration.Orchestrator;
import com.compareai.services.session.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API of the comparison chat. Clients create a session, start a request against the backends
 * they picked, then poll its status until it reports {@code completed}.
 */
@RestController
@RequestMapping("/api/chat")
public class ChatController {
  private static final Logger LOG = LoggerFactory.getLogger(ChatController.class);

  private final Orchestrator orchestrator;
  private final BackendRegistry backendRegistry;
  private final SessionService sessionService;
  private final HistoryStore historyStore;

  public ChatController(Orchestrator orchestrator,
                        BackendRegistry backendRegistry,
                        SessionService sessionService,
                        HistoryStore historyStore) {
    this.orchestrator = orchestrator;
    this.backendRegistry = backendRegistry;
    this.sessionService = sessionService;
    this.historyStore = historyStore;
  }

  @PostMapping(path = "/sessions", produces = MediaType.APPLICATION_JSON_VALUE, consumes = MediaType.APPLICATION_JSON_VALUE)
  @ResponseStatus(HttpStatus.CREATED)
  public UserSession createSession(@RequestBody SessionRequest request) {
    return sessionService.createSession(request.sessionId(), request.name(), request.projectTitle());
  }

  @GetMapping(path = "/sessions", produces = MediaType.APPLICATION_JSON_VALUE)
  public List<UserSession> sessions() {
    return sessionService.listSessions();
  }

  @DeleteMapping("/sessions/{sessionId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void deleteSession(@PathVariable String sessionId) {
    if (!sessionService.deleteSession(sessionId)) {
      throw new NotFoundException("Session not found: " + sessionId);
    }
  }

  @GetMapping(path = "/sessions/title-available", produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, Boolean> projectTitleAvailable(@RequestParam String projectTitle) {
    return Map.of("available", sessionService.isProjectTitleAvailable(projectTitle));
  }

  /** Every configured backend, or only the selectable ones with {@code ?availableOnly=true}. */
  @GetMapping(path = "/backends", produces = MediaType.APPLICATION_JSON_VALUE)
  public List<BackendInfo> backends(@RequestParam(defaultValue = "false") boolean availableOnly) {
    return availableOnly ? backendRegistry.listAvailable() : backendRegistry.listBackends();
  }

  /**
   * Starts a request and returns its id immediately.
   *
   * Request body:
   * {
   *   "sessionId": "...",
   *   "message": "What is the capital of France?",
   *   "backends": ["openai", "anthropic"]
   * }
   */
  @PostMapping(path = "/start", produces = MediaType.APPLICATION_JSON_VALUE, consumes = MediaType.APPLICATION_JSON_VALUE)
  @ResponseStatus(HttpStatus.ACCEPTED)
  public StartResponse start(@RequestBody ChatRequest request) {
    UserSession user = sessionService.getSession(request.sessionId());
    List<Backend> backends = backendRegistry.resolve(request.backends());
    String requestId = orchestrator.startProcessing(user, backends, request.message());
    LOG.debug("Accepted request {} for session {}", requestId, user.sessionId());
    return new StartResponse(requestId, "processing");
  }

  @GetMapping(path = "/status/{requestId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> status(@PathVariable String requestId) {
    return orchestrator.getStatus(requestId)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Request not found")));
  }

  /**
   * Blocking variant: starts the request and waits for it, returning partial results with
   * {@code "timeout": true} if the wait runs out.
   */
  @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE, consumes = MediaType.APPLICATION_JSON_VALUE)
  public AggregatedResult chat(@RequestBody ChatRequest request) {
    UserSession user = sessionService.getSession(request.sessionId());
    List<Backend> backends = backendRegistry.resolve(request.backends());
    return orchestrator.processMessage(user, backends, request.message());
  }

  @GetMapping(path = "/history/{sessionId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public List<Message> history(@PathVariable String sessionId) {
    return historyStore.getAll(sessionService.getSession(sessionId).sessionId());
  }

  @DeleteMapping("/history/{sessionId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void clearHistory(@PathVariable String sessionId) {
    historyStore.clear(sessionService.getSession(sessionId).sessionId());
  }

  @GetMapping("/health")
  public Map<String, String> health() {
    return Map.of("status", "ok");
  }

  public record SessionRequest(String sessionId, String name, String projectTitle) {}

  public record ChatRequest(String sessionId, String message, List<String> backends) {}

  public record StartResponse(String requestId, String status) {}
}
