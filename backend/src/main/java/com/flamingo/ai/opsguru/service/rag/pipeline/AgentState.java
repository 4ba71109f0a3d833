package com.flamingo.ai.opsguru.service.rag.pipeline;

import com.flamingo.ai.opsguru.domain.enums.DataFetchStatus;
import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import com.flamingo.ai.opsguru.service.rag.query.QueryMetadata;
import com.flamingo.ai.opsguru.service.rag.reasoning.ResponseMetadata;
import com.flamingo.ai.opsguru.service.rag.retrieval.Citation;
import com.flamingo.ai.opsguru.service.rag.retrieval.RetrievalHit;
import com.flamingo.ai.opsguru.service.rag.telemetry.DataPoint;
import com.flamingo.ai.opsguru.service.rag.validation.GuardrailResult;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable state threaded through the answering pipeline. A fresh instance is created per
 * request; stages never mutate it but return a {@link StateUpdate} that {@link #merge(StateUpdate)}
 * folds in.
 */
@Value
@Builder(toBuilder = true)
public class AgentState {

  String sessionId;
  String query;
  String transformedQuery;
  QueryMetadata queryMetadata;

  @Builder.Default List<ConversationTurn> messages = List.of();

  TurbineModel turbineModel;

  @Builder.Default List<DataPoint> dataPoints = List.of();

  DataFetchStatus dataFetchStatus;

  @Builder.Default List<RetrievalHit> retrievedDocuments = List.of();

  String hierarchicalContext;

  @Builder.Default List<Citation> citations = List.of();

  String llmResponse;
  ResponseMetadata responseMetadata;
  Double confidenceScore;
  GuardrailResult guardrailResult;

  @Singular List<String> errors;

  /**
   * Returns a new state with the non-null fields of {@code update} applied and its errors appended.
   * Fields the update leaves null keep their current value.
   */
  public AgentState merge(StateUpdate update) {
    AgentStateBuilder next = toBuilder();
    if (update.getTransformedQuery() != null) {
      next.transformedQuery(update.getTransformedQuery());
    }
    if (update.getQueryMetadata() != null) {
      next.queryMetadata(update.getQueryMetadata());
    }
    if (update.getTurbineModel() != null) {
      next.turbineModel(update.getTurbineModel());
    }
    if (update.getDataPoints() != null) {
      next.dataPoints(List.copyOf(update.getDataPoints()));
    }
    if (update.getDataFetchStatus() != null) {
      next.dataFetchStatus(update.getDataFetchStatus());
    }
    if (update.getRetrievedDocuments() != null) {
      next.retrievedDocuments(List.copyOf(update.getRetrievedDocuments()));
    }
    if (update.getHierarchicalContext() != null) {
      next.hierarchicalContext(update.getHierarchicalContext());
    }
    if (update.getCitations() != null) {
      next.citations(List.copyOf(update.getCitations()));
    }
    if (update.getLlmResponse() != null) {
      next.llmResponse(update.getLlmResponse());
    }
    if (update.getResponseMetadata() != null) {
      next.responseMetadata(update.getResponseMetadata());
    }
    if (update.getConfidenceScore() != null) {
      next.confidenceScore(update.getConfidenceScore());
    }
    if (update.getGuardrailResult() != null) {
      next.guardrailResult(update.getGuardrailResult());
    }
    next.errors(update.getErrors());
    return next.build();
  }
}
