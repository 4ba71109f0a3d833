package com.flamingo.ai.opsguru.domain.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.opsguru.domain.entity.ConversationSession;
import com.flamingo.ai.opsguru.domain.enums.MessageRole;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

@DataJpaTest
@DisplayName("ConversationSessionRepository Tests")
class ConversationSessionRepositoryTest {

  @Autowired private TestEntityManager entityManager;

  @Autowired private ConversationSessionRepository repository;

  private final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

  private ConversationSession session(String id, Instant expiresAt) {
    return ConversationSession.builder()
        .sessionId(id)
        .messages(
            List.of(
                ConversationTurn.user("Low oil pressure on the SMT60?", now),
                ConversationTurn.assistant("Check the relief valve.", now)))
        .lastUpdated(now)
        .expiresAt(expiresAt)
        .build();
  }

  @Test
  @DisplayName("Should store and reload the conversation turns")
  void shouldPersistTurns() {
    entityManager.persistAndFlush(session("session-aaaaaaaaaaaa", now.plus(Duration.ofDays(30))));
    entityManager.clear();

    ConversationSession loaded =
        repository.findBySessionIdAndExpiresAtAfter("session-aaaaaaaaaaaa", now).orElseThrow();

    assertThat(loaded.getCreatedAt()).isNotNull();
    assertThat(loaded.getMessages()).hasSize(2);
    assertThat(loaded.getMessages().get(0).role()).isEqualTo(MessageRole.USER);
    assertThat(loaded.getMessages().get(0).content()).isEqualTo("Low oil pressure on the SMT60?");
    assertThat(loaded.getMessages().get(1).role()).isEqualTo(MessageRole.ASSISTANT);
    assertThat(loaded.getMessages().get(1).timestamp()).isEqualTo(now);
  }

  @Test
  @DisplayName("Should treat expired sessions as absent")
  void shouldHideExpiredSessions() {
    entityManager.persistAndFlush(session("session-expired00000", now.minusSeconds(60)));

    assertThat(repository.findBySessionIdAndExpiresAtAfter("session-expired00000", now))
        .isEmpty();
    assertThat(repository.findById("session-expired00000")).isPresent();
  }

  @Test
  @DisplayName("Should delete only expired sessions")
  void shouldDeleteExpired() {
    entityManager.persist(session("session-live00000000", now.plus(Duration.ofDays(1))));
    entityManager.persist(session("session-old000000000", now.minus(Duration.ofDays(1))));
    entityManager.flush();

    int removed = repository.deleteExpired(now);

    assertThat(removed).isEqualTo(1);
    assertThat(repository.findById("session-old000000000")).isEmpty();
    assertThat(repository.findById("session-live00000000")).isPresent();
  }
}
