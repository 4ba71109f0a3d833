package com.flamingo.ai.opsguru.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of the telemetry fetch for a request. */
public enum DataFetchStatus {
  DISABLED,
  OK,
  ERROR;

  @JsonValue
  public String getValue() {
    return name().toLowerCase();
  }
}
