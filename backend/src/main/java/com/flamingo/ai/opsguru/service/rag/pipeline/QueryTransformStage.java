package com.flamingo.ai.opsguru.service.rag.pipeline;

import com.flamingo.ai.opsguru.service.rag.query.QueryTransformer;
import com.flamingo.ai.opsguru.service.rag.query.TransformedQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Detects the turbine model and enriches the query. */
@Component
@RequiredArgsConstructor
public class QueryTransformStage implements PipelineStage {

  private final QueryTransformer queryTransformer;

  @Override
  public String name() {
    return "query_transform";
  }

  @Override
  public StateUpdate apply(AgentState state) {
    TransformedQuery transformed =
        queryTransformer.transform(state.getQuery(), state.getMessages());
    return StateUpdate.builder()
        .transformedQuery(transformed.text())
        .queryMetadata(transformed.metadata())
        .turbineModel(transformed.metadata().turbineModel())
        .build();
  }
}
