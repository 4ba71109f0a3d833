package com.flamingo.ai.opsguru.service.rag.reasoning;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import com.flamingo.ai.opsguru.exception.ReasoningBackendException;
import com.flamingo.ai.opsguru.service.rag.retrieval.Citation;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for third-party "fast reasoning" APIs that speak the OpenAI chat-completions
 * protocol. The turbine model and citations travel in a {@code metadata} object next to the
 * messages.
 */
@Component
@Slf4j
public class ExternalReasoningClient {

  private final WebClient webClient;
  private final Environment environment;

  public ExternalReasoningClient(WebClient.Builder webClientBuilder, Environment environment) {
    this.environment = environment;
    this.webClient =
        webClientBuilder
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
            .build();
  }

  /** Whether every environment variable the backend needs is present. */
  public boolean isConfigured(ReasoningBackend.ExternalHttp backend) {
    if (backend.endpoint() == null || backend.endpoint().isBlank()) {
      return false;
    }
    List<String> required = new ArrayList<>(backend.requiredEnvKeys());
    if (backend.apiKeyEnv() != null && !backend.apiKeyEnv().isBlank()) {
      required.add(backend.apiKeyEnv());
    }
    return required.stream().allMatch(key -> hasText(environment.getProperty(key)));
  }

  /**
   * Generates an answer.
   *
   * @param modelKey catalog key, for diagnostics
   * @param backend endpoint, credentials and parameters
   * @param prompt prompt to send
   * @return the answer text, or null if the API returned no content
   * @throws ReasoningBackendException on transport errors or timeout
   */
  @Timed(value = "reasoning.external", description = "Time for an external reasoning call")
  public String invoke(
      String modelKey, ReasoningBackend.ExternalHttp backend, ReasoningPrompt prompt) {
    CompletionRequest request = toRequest(backend, prompt);
    String apiKey =
        backend.apiKeyEnv() == null ? null : environment.getProperty(backend.apiKeyEnv());

    try {
      log.debug("Invoking external model {} at {}", modelKey, backend.endpoint());
      CompletionResponse response =
          webClient
              .post()
              .uri(backend.endpoint())
              .contentType(MediaType.APPLICATION_JSON)
              .headers(
                  headers -> {
                    if (hasText(apiKey)) {
                      headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
                    }
                  })
              .bodyValue(request)
              .retrieve()
              .bodyToMono(CompletionResponse.class)
              .timeout(backend.timeout())
              .block();
      return firstContent(response);
    } catch (RuntimeException e) {
      throw new ReasoningBackendException(
          modelKey, "External model " + modelKey + " failed: " + e.getMessage(), e);
    }
  }

  private static CompletionRequest toRequest(
      ReasoningBackend.ExternalHttp backend, ReasoningPrompt prompt) {
    List<Message> messages = new ArrayList<>();
    messages.add(new Message("system", prompt.systemPrompt()));
    for (ConversationTurn turn : prompt.history()) {
      messages.add(new Message(turn.role().getValue(), turn.content()));
    }
    messages.add(new Message("user", prompt.userPrompt()));

    return new CompletionRequest(
        backend.modelId(),
        messages,
        backend.parameters().maxTokens(),
        backend.parameters().temperature(),
        new RequestMetadata(prompt.turbineModel(), prompt.citations()));
  }

  private static String firstContent(CompletionResponse response) {
    if (response == null || response.choices() == null || response.choices().isEmpty()) {
      return null;
    }
    Choice choice = response.choices().get(0);
    return choice.message() == null ? null : choice.message().content();
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record CompletionRequest(
      String model,
      List<Message> messages,
      @JsonProperty("max_tokens") int maxTokens,
      double temperature,
      RequestMetadata metadata) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Message(String role, String content) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record RequestMetadata(
      @JsonProperty("turbine_model") String turbineModel, List<Citation> citations) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record CompletionResponse(List<Choice> choices, Map<String, Object> usage) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Choice(int index, Message message) {}
}
