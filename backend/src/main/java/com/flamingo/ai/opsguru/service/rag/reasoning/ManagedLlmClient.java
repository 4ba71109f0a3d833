package com.flamingo.ai.opsguru.service.rag.reasoning;

import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import com.flamingo.ai.opsguru.exception.ReasoningBackendException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Invokes models served by the managed LLM gateway. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ManagedLlmClient {

  private final ChatModel chatModel;

  /**
   * Generates an answer.
   *
   * @param modelKey catalog key, for diagnostics
   * @param backend model id and inference parameters
   * @param prompt prompt to send
   * @return the answer text, possibly blank
   * @throws ReasoningBackendException if the model id is missing or the call fails
   */
  @Timed(value = "reasoning.managed", description = "Time for a managed LLM call")
  public String invoke(
      String modelKey, ReasoningBackend.ManagedLlm backend, ReasoningPrompt prompt) {
    if (backend.modelId() == null || backend.modelId().isBlank()) {
      throw new ReasoningBackendException(modelKey, "No model id configured for " + modelKey);
    }

    ChatRequest request =
        ChatRequest.builder()
            .messages(toMessages(prompt))
            .parameters(
                ChatRequestParameters.builder()
                    .modelName(backend.modelId())
                    .maxOutputTokens(backend.parameters().maxTokens())
                    .temperature(backend.parameters().temperature())
                    .build())
            .build();

    try {
      log.debug("Invoking managed model {} ({})", modelKey, backend.modelId());
      ChatResponse response = chatModel.chat(request);
      if (response == null || response.aiMessage() == null) {
        return null;
      }
      return response.aiMessage().text();
    } catch (RuntimeException e) {
      throw new ReasoningBackendException(
          modelKey, "Managed model " + modelKey + " failed: " + e.getMessage(), e);
    }
  }

  private static List<ChatMessage> toMessages(ReasoningPrompt prompt) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(SystemMessage.from(prompt.systemPrompt()));
    for (ConversationTurn turn : prompt.history()) {
      if (turn.isUser()) {
        messages.add(UserMessage.from(turn.content()));
      } else {
        messages.add(AiMessage.from(turn.content()));
      }
    }
    messages.add(UserMessage.from(prompt.userPrompt()));
    return messages;
  }
}
