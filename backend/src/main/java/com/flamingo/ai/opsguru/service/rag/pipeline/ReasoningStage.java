package com.flamingo.ai.opsguru.service.rag.pipeline;

import com.flamingo.ai.opsguru.service.rag.reasoning.ReasoningEngine;
import com.flamingo.ai.opsguru.service.rag.reasoning.ReasoningResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Generates the draft answer; an unexpected engine failure yields the failure response. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReasoningStage implements PipelineStage {

  private final ReasoningEngine reasoningEngine;

  @Override
  public String name() {
    return "reasoning";
  }

  @Override
  public StateUpdate apply(AgentState state) {
    ReasoningResult result;
    try {
      result = reasoningEngine.generate(state);
    } catch (RuntimeException e) {
      log.error("[{}] Reasoning failed unexpectedly", state.getSessionId(), e);
      return StateUpdate.builder()
          .llmResponse(ReasoningEngine.FAILURE_RESPONSE)
          .error("reasoning: " + e.getMessage())
          .build();
    }
    return StateUpdate.builder()
        .llmResponse(result.text())
        .responseMetadata(result.metadata())
        .errors(result.errors())
        .build();
  }
}
