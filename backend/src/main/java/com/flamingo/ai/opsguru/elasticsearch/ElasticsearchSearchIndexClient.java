package com.flamingo.ai.opsguru.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.MgetRequest;
import co.elastic.clients.elasticsearch.core.MgetResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.get.GetResult;
import co.elastic.clients.elasticsearch.core.mget.MultiGetResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.exception.SearchException;
import com.flamingo.ai.opsguru.service.rag.retrieval.RetrievalHit;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link SearchIndexClient} backed by an Elasticsearch/OpenSearch index of turbine manual chunks.
 *
 * <p>Expected document shape: {@code text}, {@code source}, {@code turbine_model}, {@code
 * document_type}, {@code embedding} and a {@code metadata} object holding {@code page}, {@code
 * section_path}, {@code document_id} and {@code chunk_index}. Chunk ids follow {@link
 * SearchIndexClient#chunkId(String, int)}.
 */
@Component
@Slf4j
public class ElasticsearchSearchIndexClient implements SearchIndexClient {

  static final String EMBEDDING_FIELD = "embedding";
  static final List<String> LEXICAL_FIELDS = List.of("text^2", "source");
  static final List<String> SOURCE_FIELDS =
      List.of("text", "metadata", "source", "turbine_model", "document_type");
  private static final List<String> TOP_LEVEL_FILTER_FIELDS =
      List.of("turbine_model", "document_type");

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final int candidatesMultiplier;
  private final int searchTimeoutSeconds;

  public ElasticsearchSearchIndexClient(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      OpsGuruProperties properties) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    OpsGuruProperties.Retrieval retrieval = properties.getRetrieval();
    this.indexName = retrieval.getIndexName();
    this.candidatesMultiplier = retrieval.getCandidatesMultiplier();
    this.searchTimeoutSeconds = retrieval.getSearchTimeoutSeconds();
  }

  @Override
  @Timed(value = "elasticsearch.hybrid_search", description = "Time for hybrid search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "hybridSearchFallback")
  @SuppressWarnings({"rawtypes", "unchecked"})
  public List<RetrievalHit> hybridSearch(
      String query, List<Float> queryVector, Map<String, String> filters, int topK) {
    try {
      SearchRequest request = buildHybridSearchRequest(query, queryVector, filters, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);

      List<RetrievalHit> hits = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        hits.add(mapHit(hit.id(), hit.score(), (Map<String, Object>) hit.source()));
      }
      log.debug(
          "[hybridSearch] index={} filters={} topK={} returned={}",
          indexName,
          filters,
          topK,
          hits.size());
      meterRegistry.counter("retrieval.hybrid_search").increment();
      return hits;
    } catch (IOException | ElasticsearchException e) {
      log.error("Hybrid search failed for {}: {}", indexName, e.getMessage(), e);
      throw new SearchException("Hybrid search failed on index " + indexName, e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.get_by_ids", description = "Time to fetch chunks by id")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "getByIdsFallback")
  @SuppressWarnings({"rawtypes", "unchecked"})
  public List<RetrievalHit> getByIds(List<String> ids) {
    if (ids == null || ids.isEmpty()) {
      return List.of();
    }
    try {
      MgetRequest request = MgetRequest.of(m -> m.index(indexName).ids(ids));
      MgetResponse<Map> response = elasticsearchClient.mget(request, Map.class);

      List<RetrievalHit> found = new ArrayList<>();
      for (MultiGetResponseItem<Map> item : response.docs()) {
        if (!item.isResult()) {
          continue;
        }
        GetResult<Map> result = item.result();
        if (result.found() && result.source() != null) {
          found.add(mapHit(result.id(), null, (Map<String, Object>) result.source()));
        }
      }
      return found;
    } catch (IOException | ElasticsearchException e) {
      log.warn("Chunk lookup failed for {} ids: {}", ids.size(), e.getMessage());
      throw new SearchException("Chunk lookup failed on index " + indexName, e);
    }
  }

  @SuppressWarnings("unused")
  private List<RetrievalHit> hybridSearchFallback(
      String query, List<Float> queryVector, Map<String, String> filters, int topK, Throwable t) {
    meterRegistry.counter("retrieval.hybrid_search.fallback").increment();
    throw asSearchException("Hybrid search unavailable", t);
  }

  @SuppressWarnings("unused")
  private List<RetrievalHit> getByIdsFallback(List<String> ids, Throwable t) {
    throw asSearchException("Chunk lookup unavailable", t);
  }

  private static SearchException asSearchException(String message, Throwable t) {
    if (t instanceof SearchException searchException) {
      return searchException;
    }
    return new SearchException(message + ": " + t.getMessage(), t);
  }

  /**
   * Builds the hybrid query: a bool with a kNN clause and a fuzzy multi_match clause as {@code
   * should}, at least one of which must match, plus exact-match filters.
   */
  @VisibleForTesting
  SearchRequest buildHybridSearchRequest(
      String query, List<Float> queryVector, Map<String, String> filters, int topK) {
    Query knnClause =
        Query.of(
            q ->
                q.knn(
                    k ->
                        k.field(EMBEDDING_FIELD)
                            .queryVector(queryVector)
                            .k(topK)
                            .numCandidates(topK * candidatesMultiplier)));
    Query lexicalClause =
        Query.of(
            q ->
                q.multiMatch(
                    mm ->
                        mm.query(query)
                            .fields(LEXICAL_FIELDS)
                            .type(TextQueryType.BestFields)
                            .fuzziness("AUTO")));

    List<Query> filterClauses = new ArrayList<>();
    if (filters != null) {
      filters.forEach(
          (key, value) -> {
            if (value != null && !value.isBlank()) {
              String field = filterField(key);
              filterClauses.add(Query.of(q -> q.term(t -> t.field(field).value(value))));
            }
          });
    }

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .size(topK)
                .timeout(searchTimeoutSeconds + "s")
                .source(src -> src.filter(f -> f.includes(SOURCE_FIELDS)))
                .query(
                    q ->
                        q.bool(
                            b ->
                                b.should(knnClause)
                                    .should(lexicalClause)
                                    .minimumShouldMatch("1")
                                    .filter(filterClauses))));
  }

  /** Top-level tags are keyword fields; anything else lives under {@code metadata}. */
  @VisibleForTesting
  static String filterField(String key) {
    if (TOP_LEVEL_FILTER_FIELDS.contains(key)) {
      return key;
    }
    return "metadata." + key + ".keyword";
  }

  @VisibleForTesting
  @SuppressWarnings("unchecked")
  static RetrievalHit mapHit(String id, Double score, Map<String, Object> source) {
    Map<String, Object> src = source == null ? Map.of() : source;
    Map<String, Object> metadata =
        src.get("metadata") instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();

    String sectionPath = asString(metadata.get("section_path"));
    if (sectionPath == null) {
      sectionPath = asString(metadata.get("section"));
    }

    return new RetrievalHit(
        id,
        asString(src.getOrDefault("text", "")),
        asString(src.getOrDefault("source", "unknown")),
        score == null ? 0.0 : score,
        asInteger(metadata.get("page")),
        sectionPath,
        asString(metadata.get("document_id")),
        asInteger(metadata.get("chunk_index")),
        asString(src.get("turbine_model")),
        asString(src.get("document_type")),
        List.of());
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  private static Integer asInteger(Object value) {
    if (value instanceof Number n) {
      return n.intValue();
    }
    if (value instanceof String s && !s.isBlank()) {
      try {
        return Integer.valueOf(s.trim());
      } catch (NumberFormatException e) {
        log.debug("Ignoring non-numeric metadata value '{}'", s);
        return null;
      }
    }
    return null;
  }
}
