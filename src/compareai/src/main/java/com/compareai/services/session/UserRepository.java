package com.compareai.services.session;

import com.compareai.core.model.UserSession;

import java.util.List;
import java.util.Optional;

/** Storage of user sessions. */
public interface UserRepository {

  /** Inserts or replaces the session with the same id. */
  void save(UserSession user);

  Optional<UserSession> findBySessionId(String sessionId);

  Optional<UserSession> findByProjectTitle(String projectTitle);

  /** All sessions, newest first. */
  List<UserSession> findAll();

  boolean delete(String sessionId);
}
