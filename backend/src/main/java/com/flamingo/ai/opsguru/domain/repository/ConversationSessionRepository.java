package com.flamingo.ai.opsguru.domain.repository;

import com.flamingo.ai.opsguru.domain.entity.ConversationSession;
import java.time.Instant;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for ConversationSession entities. */
@Repository
public interface ConversationSessionRepository extends JpaRepository<ConversationSession, String> {

  /** Finds a session that has not expired at {@code now}. */
  Optional<ConversationSession> findBySessionIdAndExpiresAtAfter(String sessionId, Instant now);

  /** Deletes every session that expired at or before {@code now}. */
  @Modifying(clearAutomatically = true)
  @Transactional
  @Query("DELETE FROM ConversationSession s WHERE s.expiresAt <= :now")
  int deleteExpired(@Param("now") Instant now);
}
