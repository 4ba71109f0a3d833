package com.flamingo.ai.opsguru.service.rag.retrieval;

import java.util.List;

/** Output of the knowledge retrieval stage. */
public record RetrievalResult(
    List<RetrievalHit> hits, String context, List<Citation> citations, List<String> errors) {

  public RetrievalResult {
    hits = List.copyOf(hits);
    citations = List.copyOf(citations);
    errors = List.copyOf(errors);
  }

  public static RetrievalResult empty(String context, List<String> errors) {
    return new RetrievalResult(List.of(), context, List.of(), errors);
  }
}
