package com.compareai.services.backend;

import com.compareai.core.api.BackendAdapter;
import com.compareai.core.model.Message;
import com.compareai.exception.BackendException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Backend adapter delegating to a LangChain4j {@link ChatLanguageModel}. The configured system
 * prompt goes first, followed by the context as user/assistant turns.
 */
public class LangChain4jBackendAdapter implements BackendAdapter {

  private final ChatLanguageModel chatModel;
  private final String systemPrompt;
  private final String model;

  public LangChain4jBackendAdapter(ChatLanguageModel chatModel, String systemPrompt, String model) {
    this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
    this.systemPrompt = systemPrompt;
    this.model = model;
  }

  @Override
  public String respond(List<Message> context) {
    List<ChatMessage> messages = toChatMessages(context);
    if (messages.stream().noneMatch(m -> m instanceof UserMessage)) {
      throw new BackendException("Context contains no user message to answer");
    }
    Response<AiMessage> response = chatModel.generate(messages);
    if (response == null || response.content() == null) {
      throw new BackendException("Provider returned no message");
    }
    String text = response.content().text();
    if (text == null || text.isBlank()) {
      throw new BackendException("Provider returned an empty response");
    }
    return text;
  }

  @Override
  public String model() {
    return model == null ? BackendAdapter.super.model() : model;
  }

  List<ChatMessage> toChatMessages(List<Message> context) {
    List<ChatMessage> messages = new ArrayList<>();
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      messages.add(SystemMessage.from(systemPrompt));
    }
    if (context == null) return messages;
    for (Message m : context) {
      if (m.content().isBlank()) continue;
      messages.add(m.isUser() ? UserMessage.from(m.content()) : AiMessage.from(m.content()));
    }
    return messages;
  }
}
