package com.flamingo.ai.opsguru.service.rag.validation;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.service.rag.retrieval.Citation;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Blends retrieval quality and telemetry availability into a confidence score.
 *
 * <p>No citations: the no-citation base. Otherwise the citation base plus the relevance weight
 * times the mean normalized relevance. Telemetry adds a flat bonus. The result is capped and
 * rounded to three decimals.
 */
@Component
@RequiredArgsConstructor
public class ConfidenceScorer {

  private final OpsGuruProperties properties;

  public double score(List<Citation> citations, boolean hasTelemetry) {
    OpsGuruProperties.Validation config = properties.getValidation();

    double confidence;
    if (citations == null || citations.isEmpty()) {
      confidence = config.getNoCitationConfidence();
    } else {
      double meanRelevance =
          citations.stream().mapToDouble(Citation::relevanceScore).average().orElse(0.0);
      confidence = config.getCitationBaseConfidence() + config.getRelevanceWeight() * meanRelevance;
    }

    if (hasTelemetry) {
      confidence += config.getTelemetryBonus();
    }

    confidence = Math.max(0.0, Math.min(config.getMaxConfidence(), confidence));
    return Math.round(confidence * 1000.0) / 1000.0;
  }
}
