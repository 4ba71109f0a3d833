package com.flamingo.ai.opsguru.service.rag.reasoning;

import com.flamingo.ai.opsguru.exception.ReasoningBackendException;
import com.flamingo.ai.opsguru.service.rag.pipeline.AgentState;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates the draft answer. The primary catalog model is tried first; if it fails or answers
 * with nothing, exactly one fallback managed model is tried. If both fail the answer is {@link
 * #FAILURE_RESPONSE}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReasoningEngine {

  public static final String FAILURE_RESPONSE =
      "I'm sorry, I was unable to generate a response at this time. Please try again shortly or"
          + " consult the equipment documentation directly.";

  private final ModelCatalog modelCatalog;
  private final PromptBuilder promptBuilder;
  private final ManagedLlmClient managedLlmClient;
  private final ExternalReasoningClient externalReasoningClient;
  private final MeterRegistry meterRegistry;

  @Timed(value = "reasoning.generate", description = "Time to generate an answer")
  public ReasoningResult generate(AgentState state) {
    ReasoningPrompt prompt = promptBuilder.build(state);
    List<String> errors = new ArrayList<>();

    String primaryKey = modelCatalog.resolvePrimaryKey();
    ModelEntry primary = modelCatalog.find(primaryKey).orElseThrow();
    boolean externalAttempted = false;

    String text = null;
    ModelEntry used = primary;
    try {
      if (primary.backend() instanceof ReasoningBackend.ExternalHttp external) {
        if (externalReasoningClient.isConfigured(external)) {
          externalAttempted = true;
          text = externalReasoningClient.invoke(primaryKey, external, prompt);
        } else {
          errors.add("reasoning: external model " + primaryKey + " is not configured");
          log.warn("External model {} not configured, skipping to fallback", primaryKey);
        }
      } else if (primary.backend() instanceof ReasoningBackend.ManagedLlm managed) {
        text = managedLlmClient.invoke(primaryKey, managed, prompt);
      }
      if (isBlank(text) && errors.isEmpty()) {
        errors.add("reasoning: model " + primaryKey + " returned an empty response");
      }
    } catch (ReasoningBackendException e) {
      errors.add("reasoning: " + e.getMessage());
      log.warn("Primary model {} failed: {}", primaryKey, e.getMessage());
    }

    boolean fallbackUsed = false;
    if (isBlank(text)) {
      Optional<ModelEntry> fallback =
          modelCatalog.resolveFallbackKey(primaryKey).flatMap(modelCatalog::find);
      if (fallback.isPresent()) {
        fallbackUsed = true;
        used = fallback.get();
        meterRegistry.counter("reasoning.fallback", "model", used.key()).increment();
        log.info("Falling back from {} to {}", primaryKey, used.key());
        text = invokeFallback(used, prompt, errors);
      } else {
        log.warn("No fallback model available for {}", primaryKey);
      }
    }

    if (isBlank(text)) {
      errors.add("reasoning: no model produced a response");
      log.error("All reasoning backends failed (primary={})", primaryKey);
      meterRegistry.counter("reasoning.exhausted").increment();
      return new ReasoningResult(
          FAILURE_RESPONSE,
          new ResponseMetadata(null, null, externalAttempted, fallbackUsed, Instant.now()),
          errors);
    }

    return new ReasoningResult(
        text.strip(),
        new ResponseMetadata(
            used.key(), used.displayName(), externalAttempted, fallbackUsed, Instant.now()),
        errors);
  }

  private String invokeFallback(ModelEntry entry, ReasoningPrompt prompt, List<String> errors) {
    try {
      String text =
          managedLlmClient.invoke(
              entry.key(), (ReasoningBackend.ManagedLlm) entry.backend(), prompt);
      if (isBlank(text)) {
        errors.add("reasoning: fallback model " + entry.key() + " returned an empty response");
      }
      return text;
    } catch (ReasoningBackendException e) {
      errors.add("reasoning: " + e.getMessage());
      log.warn("Fallback model {} failed: {}", entry.key(), e.getMessage());
      return null;
    }
  }

  private static boolean isBlank(String text) {
    return text == null || text.isBlank();
  }
}
