package com.flamingo.ai.opsguru.service.rag.pipeline;

import com.flamingo.ai.opsguru.service.rag.retrieval.KnowledgeRetriever;
import com.flamingo.ai.opsguru.service.rag.retrieval.RetrievalResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Retrieves documentation and builds the context block and citations. */
@Component
@RequiredArgsConstructor
public class RetrievalStage implements PipelineStage {

  private final KnowledgeRetriever knowledgeRetriever;

  @Override
  public String name() {
    return "retrieval";
  }

  @Override
  public StateUpdate apply(AgentState state) {
    String query =
        state.getTransformedQuery() == null ? state.getQuery() : state.getTransformedQuery();
    RetrievalResult result = knowledgeRetriever.retrieve(query, state.getTurbineModel());
    return StateUpdate.builder()
        .retrievedDocuments(result.hits())
        .hierarchicalContext(result.context())
        .citations(result.citations())
        .errors(result.errors())
        .build();
  }
}
