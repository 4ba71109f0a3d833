package com.flamingo.ai.opsguru.exception;

/** Exception thrown when a reasoning backend cannot produce an answer. */
public class ReasoningBackendException extends RuntimeException {

  private final String modelKey;

  public ReasoningBackendException(String modelKey, String message) {
    super(message);
    this.modelKey = modelKey;
  }

  public ReasoningBackendException(String modelKey, String message, Throwable cause) {
    super(message, cause);
    this.modelKey = modelKey;
  }

  public String getModelKey() {
    return modelKey;
  }
}
