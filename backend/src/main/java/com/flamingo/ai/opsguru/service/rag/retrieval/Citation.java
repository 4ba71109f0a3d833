package com.flamingo.ai.opsguru.service.rag.retrieval;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Normalized reference to a source excerpt supporting an answer. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Citation(
    String source,
    Integer page,
    String section,
    String excerpt,
    double relevanceScore,
    String turbineModel,
    String documentType,
    String url) {}
