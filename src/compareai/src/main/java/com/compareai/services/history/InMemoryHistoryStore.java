package com.compareai.services.history;

import com.compareai.core.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps every session's history in process memory. Appends to one session are serialized on that
 * session's list; readers get copies.
 */
@Component
public class InMemoryHistoryStore implements HistoryStore {
  private final ConcurrentMap<String, List<Message>> sessions = new ConcurrentHashMap<>();

  @Override
  public void append(String sessionId, Message message) {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(message, "message");
    List<Message> history = sessions.computeIfAbsent(sessionId, k -> new ArrayList<>());
    synchronized (history) {
      history.add(message);
    }
  }

  @Override
  public List<Message> getAll(String sessionId) {
    List<Message> history = sessionId == null ? null : sessions.get(sessionId);
    if (history == null) return List.of();
    synchronized (history) {
      return List.copyOf(history);
    }
  }

  @Override
  public void clear(String sessionId) {
    if (sessionId != null) sessions.remove(sessionId);
  }
}
