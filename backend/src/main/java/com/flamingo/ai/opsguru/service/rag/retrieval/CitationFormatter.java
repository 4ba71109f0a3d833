package com.flamingo.ai.opsguru.service.rag.retrieval;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns retrieval hits into citations. Raw scores are divided by the best score of the result set,
 * clamped to [0, 1] and rounded to three decimals, so the top hit of a positively scored set always
 * reads 1.0. Each citation links to its source document when a link can be resolved.
 */
@Component
public class CitationFormatter {

  private static final String ELLIPSIS = "...";

  private final int excerptMaxChars;
  private final DocumentLinkResolver documentLinkResolver;

  public CitationFormatter(
      OpsGuruProperties properties, DocumentLinkResolver documentLinkResolver) {
    this.excerptMaxChars = properties.getRetrieval().getExcerptMaxChars();
    this.documentLinkResolver = documentLinkResolver;
  }

  public List<Citation> format(List<RetrievalHit> hits) {
    if (hits == null || hits.isEmpty()) {
      return List.of();
    }
    double maxScore = hits.stream().mapToDouble(RetrievalHit::score).max().orElse(0.0);
    double divisor = maxScore > 0 ? maxScore : 1.0;

    return hits.stream()
        .map(
            hit ->
                new Citation(
                    hit.source(),
                    hit.page(),
                    hit.sectionPath(),
                    truncate(hit.content(), excerptMaxChars),
                    normalize(hit.score(), divisor),
                    hit.turbineModel(),
                    hit.documentType(),
                    documentLinkResolver.resolve(hit.source(), hit.page())))
        .toList();
  }

  static double normalize(double score, double divisor) {
    double normalized = score / divisor;
    if (Double.isNaN(normalized)) {
      return 0.0;
    }
    normalized = Math.max(0.0, Math.min(1.0, normalized));
    return Math.round(normalized * 1000.0) / 1000.0;
  }

  /** Cuts text to {@code maxChars}, marking the cut with a trailing ellipsis. */
  static String truncate(String text, int maxChars) {
    if (text == null) {
      return "";
    }
    if (text.length() <= maxChars) {
      return text;
    }
    return text.substring(0, Math.max(0, maxChars - ELLIPSIS.length())) + ELLIPSIS;
  }
}
