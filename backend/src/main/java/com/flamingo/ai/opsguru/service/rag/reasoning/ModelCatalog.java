package com.flamingo.ai.opsguru.service.rag.reasoning;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Reasoning models available to the engine, built once from configuration at startup.
 *
 * <p>Primary model resolution: override, then configured default, then the first catalog entry,
 * then {@link #BASELINE_KEY}. Keys that are not in the catalog are skipped with a warning.
 */
@Component
@Slf4j
public class ModelCatalog {

  public static final String BASELINE_KEY = "nova-pro";

  private final Map<String, ModelEntry> entries;
  private final String modelOverride;
  private final String defaultKey;
  private final String fallbackKey;

  public ModelCatalog(
      OpsGuruProperties properties,
      @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}") String baselineModelId) {
    OpsGuruProperties.Reasoning reasoning = properties.getReasoning();
    this.modelOverride = reasoning.getModelOverride();
    this.defaultKey = reasoning.getDefaultModel();
    this.fallbackKey = reasoning.getFallbackModel();

    Map<String, ModelEntry> built = new LinkedHashMap<>();
    reasoning.getModels().forEach((key, model) -> built.put(key, toEntry(key, model)));
    if (built.isEmpty()) {
      log.warn("No reasoning models configured, using baseline '{}'", BASELINE_KEY);
      built.put(
          BASELINE_KEY,
          new ModelEntry(
              BASELINE_KEY,
              "Baseline",
              new ReasoningBackend.ManagedLlm(baselineModelId, InferenceParameters.DEFAULT)));
    }
    this.entries = Collections.unmodifiableMap(built);
    log.info(
        "Model catalog loaded: models={}, primary={}", entries.keySet(), resolvePrimaryKey());
  }

  public Optional<ModelEntry> find(String key) {
    return key == null ? Optional.empty() : Optional.ofNullable(entries.get(key));
  }

  public List<ModelEntry> entries() {
    return List.copyOf(entries.values());
  }

  /** Key of the model that answers first. */
  public String resolvePrimaryKey() {
    for (String candidate : List.of(nullToEmpty(modelOverride), nullToEmpty(defaultKey))) {
      if (candidate.isBlank()) {
        continue;
      }
      if (entries.containsKey(candidate)) {
        return candidate;
      }
      log.warn("Configured model '{}' is not in the catalog, ignoring", candidate);
    }
    return entries.keySet().iterator().next();
  }

  /**
   * Key of the managed model to try after {@code primaryKey} failed: configured fallback, then the
   * baseline key, then the configured default. Never returns the primary itself.
   */
  public Optional<String> resolveFallbackKey(String primaryKey) {
    List<String> candidates = new ArrayList<>();
    candidates.add(fallbackKey);
    candidates.add(BASELINE_KEY);
    candidates.add(defaultKey);
    for (String candidate : candidates) {
      if (candidate == null || candidate.isBlank() || candidate.equals(primaryKey)) {
        continue;
      }
      ModelEntry entry = entries.get(candidate);
      if (entry != null && entry.isManaged()) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  private static ModelEntry toEntry(String key, OpsGuruProperties.Reasoning.Model model) {
    InferenceParameters parameters =
        new InferenceParameters(model.getMaxTokens(), model.getTemperature());
    String displayName = model.getDisplayName() == null ? key : model.getDisplayName();
    ReasoningBackend backend =
        switch (model.getBackend()) {
          case EXTERNAL ->
              new ReasoningBackend.ExternalHttp(
                  model.getEndpoint(),
                  model.getApiKeyEnv(),
                  model.getModelId(),
                  model.getRequiredEnv(),
                  parameters,
                  Duration.ofMillis(model.getTimeoutMs()));
          case MANAGED -> new ReasoningBackend.ManagedLlm(model.getModelId(), parameters);
        };
    return new ModelEntry(key, displayName, backend);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
