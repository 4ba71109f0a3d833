package com.flamingo.ai.opsguru.exception;

/** Exception thrown when the telemetry gateway call fails. */
public class TelemetryException extends RuntimeException {

  public TelemetryException(String message, Throwable cause) {
    super(message, cause);
  }
}
