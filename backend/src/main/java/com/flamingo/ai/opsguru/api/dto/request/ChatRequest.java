package com.flamingo.ai.opsguru.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking the assistant a question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatRequest {

  /** Optional. A new session id is generated when absent. */
  @Size(max = 64, message = "Session id must not exceed 64 characters")
  private String sessionId;

  @NotBlank(message = "Query is required")
  @Size(max = 10000, message = "Query must not exceed 10000 characters")
  private String query;

  /** Prior turns, used when the session store has no history for this session. */
  @Builder.Default private List<ConversationTurn> messages = new ArrayList<>();
}
