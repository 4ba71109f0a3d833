package com.flamingo.ai.opsguru.service.rag.retrieval;

/** Resolves a browsable link to a cited source document. */
@FunctionalInterface
public interface DocumentLinkResolver {

  /**
   * @param source source document key as stored in the index
   * @param page one-based page of the cited chunk, may be null
   * @return the link, or null when no link can be produced
   */
  String resolve(String source, Integer page);
}
