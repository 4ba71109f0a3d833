package com.flamingo.ai.opsguru.service.rag.reasoning;

import java.time.Duration;
import java.util.List;

/** How a catalog model is reached. */
public sealed interface ReasoningBackend
    permits ReasoningBackend.ManagedLlm, ReasoningBackend.ExternalHttp {

  InferenceParameters parameters();

  /** Model served by the managed LLM gateway through the LangChain4j chat model. */
  record ManagedLlm(String modelId, InferenceParameters parameters) implements ReasoningBackend {}

  /**
   * Third-party reasoning API speaking the OpenAI chat-completions protocol.
   *
   * @param endpoint full chat-completions URL
   * @param apiKeyEnv environment variable holding the bearer key, may be null
   * @param modelId model name sent in the request body
   * @param requiredEnvKeys environment variables that must be set before the backend is tried
   * @param timeout bound on the whole call
   */
  record ExternalHttp(
      String endpoint,
      String apiKeyEnv,
      String modelId,
      List<String> requiredEnvKeys,
      InferenceParameters parameters,
      Duration timeout)
      implements ReasoningBackend {

    public ExternalHttp {
      requiredEnvKeys = requiredEnvKeys == null ? List.of() : List.copyOf(requiredEnvKeys);
    }
  }
}
