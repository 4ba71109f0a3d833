package com.flamingo.ai.opsguru.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.opsguru.domain.entity.ConversationSession;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored conversation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConversationResponse {

  private String sessionId;
  private List<ConversationTurn> messages;
  private Instant lastUpdated;

  public static ConversationResponse fromEntity(ConversationSession session) {
    return ConversationResponse.builder()
        .sessionId(session.getSessionId())
        .messages(session.getMessages())
        .lastUpdated(session.getLastUpdated())
        .build();
  }
}
