package com.flamingo.ai.opsguru.service.session;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.domain.entity.ConversationSession;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import com.flamingo.ai.opsguru.domain.repository.ConversationSessionRepository;
import com.flamingo.ai.opsguru.exception.SessionNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the SessionService. */
@Service
@Slf4j
public class SessionServiceImpl implements SessionService {

  private final ConversationSessionRepository sessionRepository;
  private final OpsGuruProperties properties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public SessionServiceImpl(
      ConversationSessionRepository sessionRepository,
      OpsGuruProperties properties,
      MeterRegistry meterRegistry) {
    this(sessionRepository, properties, meterRegistry, Clock.systemUTC());
  }

  SessionServiceImpl(
      ConversationSessionRepository sessionRepository,
      OpsGuruProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.sessionRepository = sessionRepository;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "session.load", description = "Time to load session history")
  public Optional<List<ConversationTurn>> loadHistory(String sessionId) {
    return sessionRepository
        .findBySessionIdAndExpiresAtAfter(sessionId, clock.instant())
        .map(session -> List.copyOf(session.getMessages()));
  }

  @Override
  @Transactional
  @Timed(value = "session.save", description = "Time to save session history")
  public ConversationSession save(String sessionId, List<ConversationTurn> messages) {
    Instant now = clock.instant();
    ConversationSession session =
        sessionRepository
            .findById(sessionId)
            .orElseGet(() -> ConversationSession.builder().sessionId(sessionId).build());
    session.setMessages(new ArrayList<>(messages));
    session.setLastUpdated(now);
    session.setExpiresAt(now.plus(Duration.ofDays(properties.getSession().getTtlDays())));

    ConversationSession saved = sessionRepository.save(session);
    meterRegistry.counter("session.saved").increment();
    log.debug(
        "[{}] saved {} turns, expires at {}", sessionId, messages.size(), saved.getExpiresAt());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "session.get", description = "Time to get a session")
  public ConversationSession getSession(String sessionId) {
    return sessionRepository
        .findBySessionIdAndExpiresAtAfter(sessionId, clock.instant())
        .orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  @Override
  @Transactional
  @Timed(value = "session.delete", description = "Time to delete a session")
  public void deleteSession(String sessionId) {
    ConversationSession session =
        sessionRepository
            .findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    sessionRepository.delete(session);

    log.info("Deleted session: {}", sessionId);
    meterRegistry.counter("session.deleted").increment();
  }

  @Override
  @Transactional
  @Scheduled(cron = "${opsguru.session.purge-cron:0 0 * * * *}")
  public int purgeExpired() {
    int removed = sessionRepository.deleteExpired(clock.instant());
    if (removed > 0) {
      log.info("Purged {} expired sessions", removed);
      meterRegistry.counter("session.purged").increment(removed);
    }
    return removed;
  }
}
