package com.compareai.services.session;

import com.compareai.core.model.UserSession;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryUserRepository implements UserRepository {
  private final ConcurrentMap<String, UserSession> users = new ConcurrentHashMap<>();

  @Override
  public void save(UserSession user) {
    users.put(user.sessionId(), user);
  }

  @Override
  public Optional<UserSession> findBySessionId(String sessionId) {
    return sessionId == null ? Optional.empty() : Optional.ofNullable(users.get(sessionId));
  }

  @Override
  public Optional<UserSession> findByProjectTitle(String projectTitle) {
    if (projectTitle == null) return Optional.empty();
    return users.values().stream()
        .filter(u -> projectTitle.equalsIgnoreCase(u.projectTitle()))
        .findFirst();
  }

  @Override
  public List<UserSession> findAll() {
    return users.values().stream()
        .sorted(Comparator.comparing(UserSession::createdAt).reversed())
        .collect(Collectors.toList());
  }

  @Override
  public boolean delete(String sessionId) {
    return sessionId != null && users.remove(sessionId) != null;
  }
}
