package com.compareai.services.history;

import com.compareai.core.model.Message;

import java.util.List;

/**
 * Append-only conversation history per session. Implementations must accept concurrent appends to
 * the same session without losing any of them.
 */
public interface HistoryStore {

  void append(String sessionId, Message message);

  /** Ordered copy of the session's history, oldest first; empty for unknown sessions. */
  List<Message> getAll(String sessionId);

  void clear(String sessionId);
}
