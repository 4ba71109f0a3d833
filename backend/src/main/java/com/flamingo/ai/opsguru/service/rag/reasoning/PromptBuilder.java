package com.flamingo.ai.opsguru.service.rag.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import com.flamingo.ai.opsguru.service.rag.pipeline.AgentState;
import com.flamingo.ai.opsguru.service.rag.telemetry.DataPoint;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Builds the prompt shared by all reasoning backends from the pipeline state. */
@Component
@Slf4j
public class PromptBuilder {

  static final String SYSTEM_PROMPT =
      """
      You are an expert assistant for gas turbine operations and troubleshooting.
      Answer questions from plant operators and maintenance engineers using the documentation
      excerpts and telemetry provided. Always cite your sources by file name and page when the
      documentation supports your answer. If the documentation does not cover the question, say
      so and give only general, conservative guidance. Never invent part numbers, setpoints or
      procedures, and remind the operator to follow site safety procedures for hazardous work.
      """;

  private final ObjectMapper objectMapper;
  private final int historyTurns;

  public PromptBuilder(ObjectMapper objectMapper, OpsGuruProperties properties) {
    this.objectMapper = objectMapper;
    this.historyTurns = properties.getReasoning().getHistoryTurns();
  }

  public ReasoningPrompt build(AgentState state) {
    StringBuilder user = new StringBuilder();
    user.append("Operator question: ").append(state.getQuery()).append("\n");
    String searchQuery =
        state.getTransformedQuery() == null ? state.getQuery() : state.getTransformedQuery();
    user.append("Search query: ").append(searchQuery).append("\n");
    if (state.getTurbineModel() != null) {
      user.append("Turbine model: ").append(state.getTurbineModel().name()).append("\n");
    }
    user.append("\nDocumentation context:\n")
        .append(state.getHierarchicalContext() == null ? "" : state.getHierarchicalContext())
        .append("\n");
    user.append("\nRecent telemetry: ").append(serializeTelemetry(state.getDataPoints()));

    return new ReasoningPrompt(
        SYSTEM_PROMPT,
        user.toString(),
        recentHistory(state.getMessages()),
        state.getTurbineModel() == null ? null : state.getTurbineModel().name(),
        state.getCitations());
  }

  /** Last turns of the conversation, skipping null and empty ones. */
  List<ConversationTurn> recentHistory(List<ConversationTurn> messages) {
    if (messages == null || messages.isEmpty()) {
      return List.of();
    }
    List<ConversationTurn> usable =
        messages.stream()
            .filter(t -> t != null && t.content() != null && !t.content().isBlank())
            .toList();
    return usable.subList(Math.max(0, usable.size() - historyTurns), usable.size());
  }

  private String serializeTelemetry(List<DataPoint> dataPoints) {
    if (dataPoints == null || dataPoints.isEmpty()) {
      return "none available";
    }
    try {
      return objectMapper.writeValueAsString(dataPoints);
    } catch (JsonProcessingException e) {
      log.warn("Could not serialize {} telemetry points: {}", dataPoints.size(), e.getMessage());
      return dataPoints.toString();
    }
  }
}
