package com.flamingo.ai.opsguru.service.rag.retrieval;

import java.util.List;

/**
 * A chunk returned by the hybrid search, with the adjacent chunks stitched on after retrieval.
 *
 * @param id index document id
 * @param content chunk text
 * @param source source document identifier (file name or URI)
 * @param score raw relevance score from the index
 * @param page page number, null if unknown
 * @param sectionPath section breadcrumb such as "Lube Oil > Pressure", null if unknown
 * @param documentId parent document id used to locate neighbours
 * @param chunkIndex position of the chunk within its document, null if unknown
 * @param turbineModel turbine model tag from the index
 * @param documentType document type tag from the index
 * @param neighbors adjacent chunks in chunk order
 */
public record RetrievalHit(
    String id,
    String content,
    String source,
    double score,
    Integer page,
    String sectionPath,
    String documentId,
    Integer chunkIndex,
    String turbineModel,
    String documentType,
    List<RetrievalHit> neighbors) {

  public RetrievalHit {
    neighbors = neighbors == null ? List.of() : List.copyOf(neighbors);
  }

  public RetrievalHit withNeighbors(List<RetrievalHit> newNeighbors) {
    return new RetrievalHit(
        id,
        content,
        source,
        score,
        page,
        sectionPath,
        documentId,
        chunkIndex,
        turbineModel,
        documentType,
        newNeighbors);
  }

  /** Whether the hit carries enough metadata to look up adjacent chunks. */
  public boolean hasChunkPosition() {
    return documentId != null && chunkIndex != null;
  }
}
