package com.flamingo.ai.opsguru.service.rag.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Service for embedding operator queries. Failures propagate to the caller. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens, queries are far shorter
  private static final int MAX_CHARS_PER_EMBEDDING = 8000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a query text.
   *
   * @param query the query text
   * @return embedding vector, never empty
   * @throws IllegalStateException if the model returns an empty vector
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "embedding")
  @Retry(name = "embedding")
  public List<Float> embedQuery(String query) {
    String input = query;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Query too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }

    try {
      Response<Embedding> response = embeddingModel.embed(input);
      float[] vector = response.content().vector();
      if (vector == null || vector.length == 0) {
        throw new IllegalStateException("Embedding model returned an empty vector");
      }
      meterRegistry.counter("embedding.requests.success").increment();
      return toFloatList(vector);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw e;
    }
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
