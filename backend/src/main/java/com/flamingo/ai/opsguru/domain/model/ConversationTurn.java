package com.flamingo.ai.opsguru.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flamingo.ai.opsguru.domain.enums.MessageRole;
import java.time.Instant;

/** A single user or assistant turn of a conversation. */
public record ConversationTurn(MessageRole role, String content, Instant timestamp) {

  public ConversationTurn {
    role = role == null ? MessageRole.ASSISTANT : role;
  }

  public static ConversationTurn user(String content, Instant timestamp) {
    return new ConversationTurn(MessageRole.USER, content, timestamp);
  }

  public static ConversationTurn assistant(String content, Instant timestamp) {
    return new ConversationTurn(MessageRole.ASSISTANT, content, timestamp);
  }

  @JsonIgnore
  public boolean isUser() {
    return role == MessageRole.USER;
  }
}
