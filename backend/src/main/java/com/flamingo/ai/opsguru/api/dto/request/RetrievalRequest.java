package com.flamingo.ai.opsguru.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a standalone documentation lookup. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RetrievalRequest {

  @NotBlank(message = "Query is required")
  private String query;

  /** Exact-match filters, e.g. turbine_model or document_type. */
  @Builder.Default private Map<String, String> filters = new LinkedHashMap<>();

  @Min(value = 1, message = "top_k must be at least 1")
  private Integer topK;
}
