package com.flamingo.ai.opsguru.exception;

/** Exception thrown when a conversation session does not exist or has expired. */
public class SessionNotFoundException extends RuntimeException {

  private final String sessionId;

  public SessionNotFoundException(String sessionId) {
    super("Session not found: " + sessionId);
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
