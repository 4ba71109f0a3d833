package com.flamingo.ai.opsguru.service.session;

import com.flamingo.ai.opsguru.domain.entity.ConversationSession;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import java.util.List;
import java.util.Optional;

/** Service interface for the conversation session store. */
public interface SessionService {

  /**
   * Loads the stored history of a session.
   *
   * @param sessionId the session ID
   * @return the stored turns, or empty if the session is unknown or expired
   */
  Optional<List<ConversationTurn>> loadHistory(String sessionId);

  /**
   * Replaces the stored history of a session and resets its expiry.
   *
   * @param sessionId the session ID
   * @param messages the full history to keep
   * @return the saved session
   */
  ConversationSession save(String sessionId, List<ConversationTurn> messages);

  /**
   * Gets a live session.
   *
   * @param sessionId the session ID
   * @return the session
   * @throws com.flamingo.ai.opsguru.exception.SessionNotFoundException if absent or expired
   */
  ConversationSession getSession(String sessionId);

  /**
   * Deletes a session.
   *
   * @param sessionId the session ID
   * @throws com.flamingo.ai.opsguru.exception.SessionNotFoundException if absent
   */
  void deleteSession(String sessionId);

  /**
   * Removes expired sessions.
   *
   * @return number of sessions removed
   */
  int purgeExpired();
}
