package com.compareai.services.context;

import com.compareai.core.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Chooses which part of a session's history is sent to a backend for one request.
 *
 * <p>Two sources are merged:
 * <ul>
 *   <li>important messages: user messages anywhere in the history that contain a self-introduction
 *       cue (for example "my name is"), so persistent facts survive any window;</li>
 *   <li>the tail of the recent window, after removing user questions that were already answered by
 *       an earlier request and assistant answers that belong to other requests.</li>
 * </ul>
 * The result is a subsequence of the input: messages keep their history order and appear once.
 */
@Component
public class ContextSelector {
  private static final Logger logger = LoggerFactory.getLogger(ContextSelector.class);

  private final ContextSelectionProperties properties;

  public ContextSelector(ContextSelectionProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  /**
   * @param history full ordered history of one session; treated as a snapshot
   * @param currentRequestId the request the context is built for
   * @return ordered subsequence of {@code history}; empty when the history is empty
   */
  public List<Message> select(List<Message> history, String currentRequestId) {
    if (history == null || history.isEmpty()) return Collections.emptyList();

    List<Message> snapshot = List.copyOf(history);
    int size = snapshot.size();

    Set<String> answered = new HashSet<>();
    for (Message m : snapshot) {
      if (m.isAssistant() && m.requestId() != null) answered.add(m.requestId());
    }

    // indices into the snapshot, kept sorted so the output never reorders history
    TreeSet<Integer> selected = new TreeSet<>();
    for (int i = 0; i < size; i++) {
      if (isImportant(snapshot.get(i))) selected.add(i);
    }

    int recentStart = Math.max(0, size - Math.max(0, properties.getRecentWindow()));
    List<Integer> filteredRecent = new ArrayList<>();
    for (int i = recentStart; i < size; i++) {
      if (keepRecent(snapshot.get(i), answered, currentRequestId)) filteredRecent.add(i);
    }
    int keep = Math.max(0, properties.getSelectedWindow());
    selected.addAll(filteredRecent.subList(Math.max(0, filteredRecent.size() - keep), filteredRecent.size()));

    List<Message> result = new ArrayList<>(selected.size());
    Set<String> seen = new HashSet<>();
    for (int index : selected) {
      Message m = snapshot.get(index);
      if (seen.add(m.id())) result.add(m);
    }
    logger.debug("Selected {} of {} history messages for request {}", result.size(), size, currentRequestId);
    return result;
  }

  boolean isImportant(Message message) {
    if (!message.isUser()) return false;
    String content = message.content().toLowerCase(Locale.ROOT);
    for (String phrase : properties.getImportantPhrases()) {
      if (phrase != null && !phrase.isBlank() && content.contains(phrase.toLowerCase(Locale.ROOT))) {
        return true;
      }
    }
    return false;
  }

  private static boolean keepRecent(Message message, Set<String> answered, String currentRequestId) {
    boolean current = currentRequestId != null && currentRequestId.equals(message.requestId());
    if (message.isAssistant()) {
      return current;
    }
    return current || message.requestId() == null || !answered.contains(message.requestId());
  }
}
