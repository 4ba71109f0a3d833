package com.flamingo.ai.opsguru.api.rest;

import com.flamingo.ai.opsguru.api.dto.request.RetrievalRequest;
import com.flamingo.ai.opsguru.api.dto.response.RetrievalResponse;
import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.service.rag.retrieval.Citation;
import com.flamingo.ai.opsguru.service.rag.retrieval.KnowledgeRetriever;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller exposing documentation lookup as a standalone tool. */
@RestController
@RequestMapping("/api/retrieval")
@RequiredArgsConstructor
public class RetrievalController {

  private final KnowledgeRetriever knowledgeRetriever;
  private final OpsGuruProperties properties;

  @PostMapping
  public ResponseEntity<RetrievalResponse> retrieve(@Valid @RequestBody RetrievalRequest request) {
    OpsGuruProperties.Retrieval config = properties.getRetrieval();
    int topK =
        request.getTopK() == null
            ? config.getTopK()
            : Math.min(request.getTopK(), config.getMaxTopK());
    Map<String, String> filters = request.getFilters() == null ? Map.of() : request.getFilters();

    List<Citation> citations = knowledgeRetriever.lookup(request.getQuery(), filters, topK);
    return ResponseEntity.ok(
        RetrievalResponse.builder()
            .query(request.getQuery())
            .citations(citations)
            .resultCount(citations.size())
            .build());
  }
}
