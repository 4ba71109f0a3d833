package com.flamingo.ai.opsguru.service.rag.validation;

import java.util.List;

/** Final answer text after the guardrail and confidence gates. */
public record ValidationResult(
    String response, double confidenceScore, GuardrailResult guardrailResult, List<String> errors) {

  public ValidationResult {
    errors = List.copyOf(errors);
  }
}
