package com.flamingo.ai.opsguru.service.chat;

import com.flamingo.ai.opsguru.api.dto.request.ChatRequest;
import com.flamingo.ai.opsguru.api.dto.response.ChatResponse;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import com.flamingo.ai.opsguru.service.rag.pipeline.AgentState;
import com.flamingo.ai.opsguru.service.rag.pipeline.AgentWorkflow;
import com.flamingo.ai.opsguru.service.session.SessionService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of ChatService. Loads the session history, runs the answering pipeline and stores
 * the new turns. Session store failures are logged and never fail the request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatServiceImpl implements ChatService {

  static final String SESSION_PREFIX = "session-";

  private final AgentWorkflow agentWorkflow;
  private final SessionService sessionService;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "chat.answer", description = "Time to answer a chat request")
  public ChatResponse answer(ChatRequest request) {
    String sessionId =
        request.getSessionId() == null || request.getSessionId().isBlank()
            ? newSessionId()
            : request.getSessionId();
    List<ConversationTurn> history = loadHistory(sessionId, request.getMessages());
    log.info("[{}] answering query ({} prior turns)", sessionId, history.size());

    Instant askedAt = Instant.now();
    AgentState result =
        agentWorkflow.run(
            AgentState.builder()
                .sessionId(sessionId)
                .query(request.getQuery())
                .messages(history)
                .build());

    List<ConversationTurn> updated = new ArrayList<>(history);
    updated.add(ConversationTurn.user(request.getQuery(), askedAt));
    updated.add(ConversationTurn.assistant(result.getLlmResponse(), Instant.now()));
    persist(sessionId, updated);

    boolean degraded = !result.getErrors().isEmpty();
    meterRegistry.counter("chat.requests", "degraded", String.valueOf(degraded)).increment();
    return ChatResponse.fromState(result, List.copyOf(updated));
  }

  private List<ConversationTurn> loadHistory(
      String sessionId, List<ConversationTurn> requestMessages) {
    List<ConversationTurn> fallback =
        requestMessages == null
            ? List.of()
            : requestMessages.stream().filter(Objects::nonNull).toList();
    try {
      Optional<List<ConversationTurn>> stored = sessionService.loadHistory(sessionId);
      if (stored.isPresent() && !stored.get().isEmpty()) {
        return stored.get().stream().filter(Objects::nonNull).toList();
      }
    } catch (RuntimeException e) {
      log.warn("[{}] failed to load session history: {}", sessionId, e.getMessage());
      meterRegistry.counter("session.store.errors", "operation", "load").increment();
    }
    return fallback;
  }

  private void persist(String sessionId, List<ConversationTurn> messages) {
    try {
      sessionService.save(sessionId, messages);
    } catch (RuntimeException e) {
      log.warn("[{}] failed to save session history: {}", sessionId, e.getMessage());
      meterRegistry.counter("session.store.errors", "operation", "save").increment();
    }
  }

  static String newSessionId() {
    byte[] bytes = new byte[6];
    ThreadLocalRandom.current().nextBytes(bytes);
    return SESSION_PREFIX + HexFormat.of().formatHex(bytes);
  }
}
