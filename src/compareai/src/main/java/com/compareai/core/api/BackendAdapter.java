package com.compareai.core.api;

import com.compareai.core.model.Message;
import java.util.List;

/**
 * A single provider able to answer a conversation. Implementations are called concurrently from
 * independent tasks and must not share mutable state between calls.
 */
public interface BackendAdapter {

  /**
   * Generate an answer for the given context.
   *
   * @param context ordered messages, oldest first; the last user message is the one to answer
   * @return the provider's answer text
   * @throws com.compareai.exception.BackendException or any runtime exception on failure
   */
  String respond(List<Message> context);

  /** Model identifier reported in response metadata. */
  default String model() {
    return getClass().getSimpleName();
  }
}
