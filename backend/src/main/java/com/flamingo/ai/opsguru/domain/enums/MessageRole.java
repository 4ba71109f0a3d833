package com.flamingo.ai.opsguru.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Defines the role of a conversation turn author. */
public enum MessageRole {
  /** Turn written by the operator. */
  USER,

  /** Turn produced by the assistant. */
  ASSISTANT;

  /**
   * Parses a role name leniently. Anything other than "user", including "system" and "tool", is an
   * assistant turn.
   */
  @JsonCreator
  public static MessageRole fromValue(String value) {
    if (value != null && value.trim().equalsIgnoreCase("user")) {
      return USER;
    }
    return ASSISTANT;
  }

  @JsonValue
  public String getValue() {
    return name().toLowerCase();
  }
}
