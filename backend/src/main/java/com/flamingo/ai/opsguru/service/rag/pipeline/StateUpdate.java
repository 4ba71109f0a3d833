package com.flamingo.ai.opsguru.service.rag.pipeline;

import com.flamingo.ai.opsguru.domain.enums.DataFetchStatus;
import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
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

/** Partial state returned by a pipeline stage. Null fields mean "unchanged". */
@Value
@Builder
public class StateUpdate {

  String transformedQuery;
  QueryMetadata queryMetadata;
  TurbineModel turbineModel;
  List<DataPoint> dataPoints;
  DataFetchStatus dataFetchStatus;
  List<RetrievalHit> retrievedDocuments;
  String hierarchicalContext;
  List<Citation> citations;
  String llmResponse;
  ResponseMetadata responseMetadata;
  Double confidenceScore;
  GuardrailResult guardrailResult;

  @Singular List<String> errors;

  public static StateUpdate failed(String error) {
    return StateUpdate.builder().error(error).build();
  }
}
