package com.flamingo.ai.opsguru.service.rag.reasoning;

/** One entry of the reasoning model catalog. */
public record ModelEntry(String key, String displayName, ReasoningBackend backend) {

  public boolean isManaged() {
    return backend instanceof ReasoningBackend.ManagedLlm;
  }
}
