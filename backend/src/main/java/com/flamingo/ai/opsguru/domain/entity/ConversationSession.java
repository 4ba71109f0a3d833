package com.flamingo.ai.opsguru.domain.entity;

import com.flamingo.ai.opsguru.domain.converter.ConversationTurnListConverter;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Conversation history of one operator session, kept until {@link #expiresAt}. */
@Entity
@Table(name = "conversation_sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationSession {

  @Id
  @Column(name = "session_id", length = 64)
  private String sessionId;

  @Convert(converter = ConversationTurnListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<ConversationTurn> messages = new ArrayList<>();

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant lastUpdated;

  @Column(nullable = false)
  private Instant expiresAt;

  @PrePersist
  protected void onCreate() {
    Instant now = Instant.now();
    if (createdAt == null) {
      createdAt = now;
    }
    if (lastUpdated == null) {
      lastUpdated = now;
    }
  }

  @PreUpdate
  protected void onUpdate() {
    lastUpdated = Instant.now();
  }

  public boolean isExpired(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }
}
