package com.flamingo.ai.opsguru.service.rag.retrieval;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import com.flamingo.ai.opsguru.elasticsearch.SearchIndexClient;
import com.flamingo.ai.opsguru.exception.SearchException;
import com.flamingo.ai.opsguru.service.rag.embedding.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Retrieves turbine documentation for a query: embeds it, runs one hybrid search, stitches the
 * neighbouring chunks onto each hit and derives the context block and citations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeRetriever {

  private final EmbeddingService embeddingService;
  private final SearchIndexClient searchIndexClient;
  private final HierarchicalContextAssembler contextAssembler;
  private final CitationFormatter citationFormatter;
  private final OpsGuruProperties properties;
  private final MeterRegistry meterRegistry;

  /**
   * Retrieval for the answering pipeline. Never throws; a failed search yields no hits, the
   * no-results context and an error entry.
   *
   * @param query transformed query text
   * @param turbineModel detected model used as an index filter, may be null
   * @return hits, context and citations
   */
  @Timed(value = "rag.retrieve", description = "Time for knowledge retrieval")
  public RetrievalResult retrieve(String query, TurbineModel turbineModel) {
    OpsGuruProperties.Retrieval config = properties.getRetrieval();
    Map<String, String> filters =
        turbineModel != null && config.isFilterByTurbineModel()
            ? Map.of("turbine_model", turbineModel.name())
            : Map.of();

    List<RetrievalHit> hits;
    try {
      hits = search(query, filters, config.getTopK());
    } catch (RuntimeException e) {
      log.warn("Knowledge retrieval failed, continuing without documents: {}", e.getMessage());
      meterRegistry.counter("rag.retrieve.failure").increment();
      return RetrievalResult.empty(
          HierarchicalContextAssembler.NO_RESULTS_CONTEXT,
          List.of("retrieval: " + e.getMessage()));
    }

    List<String> errors = new ArrayList<>();
    List<RetrievalHit> stitched = attachNeighbors(hits, config.getNeighborWindow(), errors);

    meterRegistry.counter("retrieval.hits").increment(stitched.size());
    log.info("Retrieved {} hits (filters={})", stitched.size(), filters);
    return new RetrievalResult(
        stitched, contextAssembler.assemble(stitched), citationFormatter.format(stitched), errors);
  }

  /**
   * Embeds and searches without neighbour stitching. Used by the retrieval tool endpoint.
   *
   * @throws SearchException if embedding or search fails
   */
  public List<Citation> lookup(String query, Map<String, String> filters, int topK) {
    return citationFormatter.format(search(query, filters, topK));
  }

  private List<RetrievalHit> search(String query, Map<String, String> filters, int topK) {
    List<Float> vector;
    try {
      vector = embeddingService.embedQuery(query);
    } catch (RuntimeException e) {
      throw new SearchException("Query embedding failed: " + e.getMessage(), e);
    }
    return searchIndexClient.hybridSearch(query, vector, filters, topK);
  }

  private List<RetrievalHit> attachNeighbors(
      List<RetrievalHit> hits, int window, List<String> errors) {
    if (window <= 0) {
      return hits;
    }
    List<RetrievalHit> stitched = new ArrayList<>(hits.size());
    for (RetrievalHit hit : hits) {
      if (!hit.hasChunkPosition()) {
        stitched.add(hit);
        continue;
      }
      List<String> ids = neighborIds(hit.documentId(), hit.chunkIndex(), window);
      try {
        stitched.add(hit.withNeighbors(searchIndexClient.getByIds(ids)));
      } catch (RuntimeException e) {
        log.warn("Neighbour fetch failed for {}: {}", hit.id(), e.getMessage());
        errors.add("retrieval: neighbour fetch failed for " + hit.id() + ": " + e.getMessage());
        stitched.add(hit.withNeighbors(List.of()));
      }
    }
    return stitched;
  }

  static List<String> neighborIds(String documentId, int chunkIndex, int window) {
    List<String> ids = new ArrayList<>();
    for (int i = chunkIndex - window; i <= chunkIndex + window; i++) {
      if (i >= 0 && i != chunkIndex) {
        ids.add(SearchIndexClient.chunkId(documentId, i));
      }
    }
    return ids;
  }
}
