package com.flamingo.ai.opsguru.service.rag.pipeline;

import com.flamingo.ai.opsguru.service.rag.validation.ResponseValidator;
import com.flamingo.ai.opsguru.service.rag.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Scores the draft answer and applies the guardrail and confidence gates. */
@Component
@RequiredArgsConstructor
public class ValidationStage implements PipelineStage {

  private final ResponseValidator responseValidator;

  @Override
  public String name() {
    return "validation";
  }

  @Override
  public StateUpdate apply(AgentState state) {
    ValidationResult result =
        responseValidator.validate(
            state.getLlmResponse(),
            state.getCitations(),
            state.getDataPoints(),
            state.getTurbineModel());
    return StateUpdate.builder()
        .llmResponse(result.response())
        .confidenceScore(result.confidenceScore())
        .guardrailResult(result.guardrailResult())
        .errors(result.errors())
        .build();
  }
}
