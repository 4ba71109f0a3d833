package com.flamingo.ai.opsguru.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.opsguru.domain.enums.DataFetchStatus;
import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import com.flamingo.ai.opsguru.service.rag.pipeline.AgentState;
import com.flamingo.ai.opsguru.service.rag.reasoning.ResponseMetadata;
import com.flamingo.ai.opsguru.service.rag.retrieval.Citation;
import com.flamingo.ai.opsguru.service.rag.telemetry.DataPoint;
import com.flamingo.ai.opsguru.service.rag.validation.GuardrailResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatResponse {

  private String sessionId;
  private String response;
  private List<Citation> citations;
  private Double confidenceScore;
  private TurbineModel turbineModel;
  private List<DataPoint> dataPoints;
  private DataFetchStatus dataFetchStatus;
  private GuardrailResult guardrailResult;
  private ResponseMetadata responseMetadata;
  private List<String> errors;
  private List<ConversationTurn> messages;

  /** Creates a ChatResponse from the final pipeline state and the updated history. */
  public static ChatResponse fromState(AgentState state, List<ConversationTurn> messages) {
    return ChatResponse.builder()
        .sessionId(state.getSessionId())
        .response(state.getLlmResponse())
        .citations(state.getCitations())
        .confidenceScore(state.getConfidenceScore())
        .turbineModel(state.getTurbineModel())
        .dataPoints(state.getDataPoints())
        .dataFetchStatus(state.getDataFetchStatus())
        .guardrailResult(state.getGuardrailResult())
        .responseMetadata(state.getResponseMetadata())
        .errors(state.getErrors())
        .messages(messages)
        .build();
  }
}
