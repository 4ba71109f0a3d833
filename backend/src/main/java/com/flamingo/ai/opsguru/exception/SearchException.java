package com.flamingo.ai.opsguru.exception;

/** Exception thrown when the turbine document index cannot be searched. */
public class SearchException extends RuntimeException {

  private final String userMessage;

  public SearchException(String message) {
    super(message);
    this.userMessage = "Document search is temporarily unavailable. Please try again.";
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Document search is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
