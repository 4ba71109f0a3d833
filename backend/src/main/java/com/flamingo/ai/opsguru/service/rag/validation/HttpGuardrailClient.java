package com.flamingo.ai.opsguru.service.rag.validation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.exception.GuardrailException;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for an external guardrail service. The service answers with a status of {@code
 * passed}/{@code compliant} or {@code blocked}/{@code non_compliant} plus a compliance code.
 */
@Component
@ConditionalOnProperty(name = "opsguru.guardrail.provider", havingValue = "http")
@Slf4j
public class HttpGuardrailClient implements GuardrailClient {

  private static final Set<String> BLOCKING_STATUSES =
      Set.of("blocked", "non_compliant", "intervened", "rejected");

  private final WebClient webClient;
  private final String endpoint;
  private final String apiKey;
  private final int timeoutMs;

  public HttpGuardrailClient(
      WebClient.Builder webClientBuilder, OpsGuruProperties properties, Environment environment) {
    OpsGuruProperties.Guardrail guardrail = properties.getGuardrail();
    this.endpoint = guardrail.getEndpoint();
    this.timeoutMs = guardrail.getTimeoutMs();
    this.apiKey =
        guardrail.getApiKeyEnv() == null ? null : environment.getProperty(guardrail.getApiKeyEnv());
    this.webClient = webClientBuilder.build();
    log.info("HTTP guardrail client initialized: endpoint={}", endpoint);
  }

  @Override
  @Timed(value = "guardrail.http", description = "Time for a guardrail evaluation")
  public GuardrailVerdict evaluate(String text, Map<String, String> context) {
    if (endpoint == null || endpoint.isBlank()) {
      throw new GuardrailException("Guardrail endpoint is not configured");
    }
    try {
      GuardrailResponse response =
          webClient
              .post()
              .uri(endpoint)
              .contentType(MediaType.APPLICATION_JSON)
              .headers(
                  headers -> {
                    if (apiKey != null && !apiKey.isBlank()) {
                      headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
                    }
                  })
              .bodyValue(new GuardrailRequest(text, context))
              .retrieve()
              .bodyToMono(GuardrailResponse.class)
              .timeout(Duration.ofMillis(timeoutMs))
              .block();
      if (response == null || response.status() == null) {
        throw new GuardrailException("Guardrail returned no verdict");
      }
      boolean compliant =
          !BLOCKING_STATUSES.contains(response.status().toLowerCase(Locale.ROOT));
      return new GuardrailVerdict(
          response.status(), compliant, response.compliance(), response.details());
    } catch (GuardrailException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new GuardrailException("Guardrail call failed: " + e.getMessage(), e);
    }
  }

  record GuardrailRequest(String text, Map<String, String> context) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record GuardrailResponse(String status, String compliance, String details) {}
}
