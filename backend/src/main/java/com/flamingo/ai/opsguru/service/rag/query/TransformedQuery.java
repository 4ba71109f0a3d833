package com.flamingo.ai.opsguru.service.rag.query;

/** Query enriched for retrieval, plus the metadata derived while enriching it. */
public record TransformedQuery(String originalQuery, String text, QueryMetadata metadata) {}
