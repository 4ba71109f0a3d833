package com.flamingo.ai.opsguru.service.rag.validation;

import com.flamingo.ai.opsguru.domain.enums.GuardrailStatus;

/**
 * Outcome of the guardrail gate.
 *
 * @param status what the gate did
 * @param compliance compliance code reported by the guardrail, null when not evaluated
 * @param details free-text explanation, null when not evaluated
 */
public record GuardrailResult(GuardrailStatus status, String compliance, String details) {

  public static GuardrailResult skipped() {
    return new GuardrailResult(GuardrailStatus.SKIPPED, null, null);
  }

  public static GuardrailResult error(String details) {
    return new GuardrailResult(GuardrailStatus.ERROR, null, details);
  }
}
