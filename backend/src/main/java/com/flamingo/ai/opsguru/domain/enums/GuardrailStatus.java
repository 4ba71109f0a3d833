package com.flamingo.ai.opsguru.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of the content-safety guardrail. */
public enum GuardrailStatus {
  /** No guardrail configured. */
  SKIPPED,

  /** Guardrail evaluated the answer and found it compliant. */
  PASSED,

  /** Guardrail flagged the answer and it was replaced. */
  INTERVENED,

  /** Guardrail could not be evaluated; the draft answer was kept. */
  ERROR;

  @JsonValue
  public String getValue() {
    return name().toLowerCase();
  }
}
