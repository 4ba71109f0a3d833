package com.flamingo.ai.opsguru.elasticsearch;

import com.flamingo.ai.opsguru.exception.SearchException;
import com.flamingo.ai.opsguru.service.rag.retrieval.RetrievalHit;
import java.util.List;
import java.util.Map;

/** Read-only access to the turbine document index. */
public interface SearchIndexClient {

  /**
   * Runs one hybrid query combining a kNN match on the query vector with a fuzzy lexical match on
   * the query text.
   *
   * @param query query text for the lexical clause
   * @param queryVector dense embedding of the query
   * @param filters exact-match filters, e.g. {@code turbine_model} or {@code document_type}
   * @param topK maximum number of hits
   * @return hits in ranked order
   * @throws SearchException if the index cannot be queried
   */
  List<RetrievalHit> hybridSearch(
      String query, List<Float> queryVector, Map<String, String> filters, int topK);

  /**
   * Fetches chunks by index id. Missing ids are skipped.
   *
   * @param ids document ids
   * @return the chunks that exist, in the order requested
   * @throws SearchException if the index cannot be queried
   */
  List<RetrievalHit> getByIds(List<String> ids);

  /** Index id of the chunk at {@code chunkIndex} within {@code documentId}. */
  static String chunkId(String documentId, int chunkIndex) {
    return documentId + "_chunk_" + chunkIndex;
  }
}
