package com.flamingo.ai.opsguru.service.rag.query;

import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import com.flamingo.ai.opsguru.service.rag.detection.TurbineModelDetector;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Enriches the raw operator query before retrieval. Pure function of its inputs: no I/O and no
 * failure modes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryTransformer {

  static final int RECENT_USER_TURNS = 3;
  static final double NON_ASCII_THRESHOLD = 0.2;
  static final String LANGUAGE_ENGLISH = "en";
  static final String LANGUAGE_NON_ASCII = "unknown-non-ascii";

  private final TurbineModelDetector turbineModelDetector;

  /**
   * Transforms a query using the conversation so far.
   *
   * @param query raw operator text
   * @param history prior turns, oldest first
   * @return the transformed query with its metadata
   */
  public TransformedQuery transform(String query, List<ConversationTurn> history) {
    String rawQuery = query == null ? "" : query;
    TurbineModel model = turbineModelDetector.detect(rawQuery).orElse(null);

    String text = model == null ? rawQuery : rawQuery + " (turbine model: " + model.name() + ")";

    QueryMetadata metadata =
        new QueryMetadata(
            model, detectLanguage(rawQuery), Instant.now(), recentUserTurns(history));

    log.debug("Transformed query: model={}, language={}", model, metadata.language());
    return new TransformedQuery(rawQuery, text, metadata);
  }

  /** Coarse script check, not a language identifier. */
  static String detectLanguage(String text) {
    if (text == null || text.isEmpty()) {
      return LANGUAGE_ENGLISH;
    }
    long total = text.codePoints().count();
    long nonAscii = text.codePoints().filter(cp -> cp > 0x7F).count();
    return (double) nonAscii / total > NON_ASCII_THRESHOLD ? LANGUAGE_NON_ASCII : LANGUAGE_ENGLISH;
  }

  private static List<String> recentUserTurns(List<ConversationTurn> history) {
    if (history == null || history.isEmpty()) {
      return List.of();
    }
    List<String> userTurns =
        history.stream()
            .filter(Objects::nonNull)
            .filter(ConversationTurn::isUser)
            .map(ConversationTurn::content)
            .filter(Objects::nonNull)
            .toList();
    return List.copyOf(
        userTurns.subList(Math.max(0, userTurns.size() - RECENT_USER_TURNS), userTurns.size()));
  }
}
