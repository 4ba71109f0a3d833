package com.flamingo.ai.opsguru.service.rag.reasoning;

import java.util.List;

/** Answer text plus how it was produced and what went wrong on the way. */
public record ReasoningResult(String text, ResponseMetadata metadata, List<String> errors) {

  public ReasoningResult {
    errors = List.copyOf(errors);
  }
}
