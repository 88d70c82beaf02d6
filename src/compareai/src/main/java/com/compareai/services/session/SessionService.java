package com.compareai.services.session;

import com.compareai.core.model.UserSession;
import com.compareai.exception.AlreadyExistsException;
import com.compareai.exception.NotFoundException;
import com.compareai.exception.ValidationException;
import com.compareai.services.history.HistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Creates and looks up user sessions. Project titles are unique across sessions.
 */
@Service
public class SessionService {
  private static final Logger logger = LoggerFactory.getLogger(SessionService.class);

  private final UserRepository repository;
  private final HistoryStore historyStore;

  public SessionService(UserRepository repository, HistoryStore historyStore) {
    this.repository = Objects.requireNonNull(repository, "repository");
    this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
  }

  /**
   * @param sessionId optional; a random id is generated when blank
   * @throws ValidationException when name or project title is blank
   * @throws AlreadyExistsException when the project title or the session id is taken
   */
  public synchronized UserSession createSession(String sessionId, String name, String projectTitle) {
    if (name == null || name.isBlank()) throw new ValidationException("name is required");
    if (projectTitle == null || projectTitle.isBlank()) throw new ValidationException("projectTitle is required");

    String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId.trim();
    if (repository.findByProjectTitle(projectTitle.trim()).isPresent()) {
      throw new AlreadyExistsException("Project title already in use: " + projectTitle.trim());
    }
    if (repository.findBySessionId(id).isPresent()) {
      throw new AlreadyExistsException("Session already exists: " + id);
    }
    UserSession user = UserSession.of(id, name.trim(), projectTitle.trim());
    repository.save(user);
    logger.info("Created session {} for project '{}'", id, user.projectTitle());
    return user;
  }

  /** @throws NotFoundException when no such session exists */
  public UserSession getSession(String sessionId) {
    return repository.findBySessionId(sessionId)
        .orElseThrow(() -> new NotFoundException("Session not found: " + sessionId));
  }

  public List<UserSession> listSessions() {
    return repository.findAll();
  }

  public boolean isProjectTitleAvailable(String projectTitle) {
    return projectTitle != null && repository.findByProjectTitle(projectTitle.trim()).isEmpty();
  }

  /** Removes the session and its history. */
  public boolean deleteSession(String sessionId) {
    historyStore.clear(sessionId);
    return repository.delete(sessionId);
  }
}
