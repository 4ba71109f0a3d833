package com.flamingo.ai.opsguru.exception;

/** Exception thrown when the content-safety guardrail cannot evaluate an answer. */
public class GuardrailException extends RuntimeException {

  public GuardrailException(String message) {
    super(message);
  }

  public GuardrailException(String message, Throwable cause) {
    super(message, cause);
  }
}
