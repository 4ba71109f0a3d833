package com.flamingo.ai.opsguru.service.rag.validation;

import com.flamingo.ai.opsguru.agent.ContentSafetyAgent;
import com.flamingo.ai.opsguru.agent.dto.SafetyAssessment;
import com.flamingo.ai.opsguru.exception.GuardrailException;
import io.micrometer.core.annotation.Timed;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Guardrail backed by an LLM safety reviewer. */
@Component
@ConditionalOnProperty(name = "opsguru.guardrail.provider", havingValue = "llm")
@RequiredArgsConstructor
@Slf4j
public class LlmGuardrailClient implements GuardrailClient {

  private final ContentSafetyAgent contentSafetyAgent;

  @Override
  @Timed(value = "guardrail.llm", description = "Time for an LLM safety review")
  public GuardrailVerdict evaluate(String text, Map<String, String> context) {
    SafetyAssessment assessment;
    try {
      assessment =
          contentSafetyAgent.review(
              text,
              context.getOrDefault("turbine_model", "unknown"),
              context.getOrDefault("confidence", "unknown"));
    } catch (RuntimeException e) {
      throw new GuardrailException("Safety review failed: " + e.getMessage(), e);
    }
    if (assessment == null) {
      throw new GuardrailException("Safety review returned no assessment");
    }
    log.debug(
        "Safety review: compliant={}, code={}",
        assessment.compliant(),
        assessment.complianceCode());
    return new GuardrailVerdict(
        assessment.compliant() ? "passed" : "blocked",
        assessment.compliant(),
        assessment.complianceCode(),
        assessment.reason());
  }
}
