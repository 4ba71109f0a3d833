package com.flamingo.ai.opsguru.service.rag.reasoning;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.config.OpsGuruProperties.Reasoning.BackendType;
import com.flamingo.ai.opsguru.config.OpsGuruProperties.Reasoning.Model;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ModelCatalog Tests")
class ModelCatalogTest {

  private OpsGuruProperties properties;

  @BeforeEach
  void setUp() {
    properties = new OpsGuruProperties();
  }

  static Model managed(String modelId) {
    Model model = new Model();
    model.setModelId(modelId);
    return model;
  }

  static Model external(String endpoint, String apiKeyEnv) {
    Model model = new Model();
    model.setBackend(BackendType.EXTERNAL);
    model.setEndpoint(endpoint);
    model.setApiKeyEnv(apiKeyEnv);
    model.setModelId("grok-beta");
    model.setTimeoutMs(1500);
    return model;
  }

  private void configureThreeModels() {
    properties.getReasoning().getModels().put("claude-sonnet", managed("gpt-4o"));
    properties.getReasoning().getModels().put("nova-pro", managed("gpt-4o-mini"));
    properties
        .getReasoning()
        .getModels()
        .put("grok-fast", external("https://api.x.ai/v1/chat/completions", "XAI_API_KEY"));
  }

  @Test
  @DisplayName("Should build typed entries from configuration")
  void shouldBuildTypedEntries() {
    configureThreeModels();
    properties.getReasoning().getModels().get("claude-sonnet").setDisplayName("Claude Sonnet");

    ModelCatalog catalog = new ModelCatalog(properties, "gpt-4o-mini");

    assertThat(catalog.entries())
        .extracting(ModelEntry::key)
        .containsExactly("claude-sonnet", "nova-pro", "grok-fast");
    assertThat(catalog.find("claude-sonnet").orElseThrow().displayName())
        .isEqualTo("Claude Sonnet");
    assertThat(catalog.find("nova-pro").orElseThrow().displayName()).isEqualTo("nova-pro");

    ModelEntry grok = catalog.find("grok-fast").orElseThrow();
    assertThat(grok.isManaged()).isFalse();
    ReasoningBackend.ExternalHttp backend = (ReasoningBackend.ExternalHttp) grok.backend();
    assertThat(backend.apiKeyEnv()).isEqualTo("XAI_API_KEY");
    assertThat(backend.timeout()).isEqualTo(Duration.ofMillis(1500));
    assertThat(backend.requiredEnvKeys()).isEmpty();
    assertThat(catalog.find(null)).isEmpty();
    assertThat(catalog.find("missing")).isEmpty();
  }

  @Test
  @DisplayName("Should fall back to a baseline entry when nothing is configured")
  void shouldUseBaselineWhenEmpty() {
    ModelCatalog catalog = new ModelCatalog(properties, "gpt-4o-mini");

    assertThat(catalog.entries()).hasSize(1);
    assertThat(catalog.resolvePrimaryKey()).isEqualTo(ModelCatalog.BASELINE_KEY);
    ModelEntry baseline = catalog.find(ModelCatalog.BASELINE_KEY).orElseThrow();
    assertThat(((ReasoningBackend.ManagedLlm) baseline.backend()).modelId())
        .isEqualTo("gpt-4o-mini");
    assertThat(catalog.resolveFallbackKey(ModelCatalog.BASELINE_KEY)).isEmpty();
  }

  @Nested
  @DisplayName("Primary resolution")
  class PrimaryResolution {

    @Test
    @DisplayName("Should prefer the override over the default")
    void shouldPreferOverride() {
      configureThreeModels();
      properties.getReasoning().setModelOverride("grok-fast");

      assertThat(new ModelCatalog(properties, "m").resolvePrimaryKey()).isEqualTo("grok-fast");
    }

    @Test
    @DisplayName("Should ignore an unknown override and use the default")
    void shouldIgnoreUnknownOverride() {
      configureThreeModels();
      properties.getReasoning().setModelOverride("gpt-9");

      assertThat(new ModelCatalog(properties, "m").resolvePrimaryKey()).isEqualTo("nova-pro");
    }

    @Test
    @DisplayName("Should use the first entry when neither override nor default is known")
    void shouldUseFirstEntry() {
      configureThreeModels();
      properties.getReasoning().setDefaultModel("unknown");

      assertThat(new ModelCatalog(properties, "m").resolvePrimaryKey())
          .isEqualTo("claude-sonnet");
    }
  }

  @Nested
  @DisplayName("Fallback resolution")
  class FallbackResolution {

    @Test
    @DisplayName("Should use the configured fallback")
    void shouldUseConfiguredFallback() {
      configureThreeModels();
      properties.getReasoning().setFallbackModel("claude-sonnet");

      assertThat(new ModelCatalog(properties, "m").resolveFallbackKey("grok-fast"))
          .contains("claude-sonnet");
    }

    @Test
    @DisplayName("Should never return the primary itself")
    void shouldNotReturnPrimary() {
      configureThreeModels();
      properties.getReasoning().setFallbackModel("nova-pro");
      properties.getReasoning().setDefaultModel("claude-sonnet");

      assertThat(new ModelCatalog(properties, "m").resolveFallbackKey("nova-pro"))
          .contains("claude-sonnet");
    }

    @Test
    @DisplayName("Should only fall back to managed models")
    void shouldSkipExternalFallback() {
      properties.getReasoning().getModels().put("nova-pro", managed("gpt-4o-mini"));
      properties
          .getReasoning()
          .getModels()
          .put("grok-fast", external("https://api.x.ai/v1/chat/completions", null));
      properties.getReasoning().setFallbackModel("grok-fast");
      properties.getReasoning().setDefaultModel("nova-pro");

      ModelCatalog catalog = new ModelCatalog(properties, "m");

      assertThat(catalog.resolveFallbackKey("nova-pro")).isEmpty();
      assertThat(catalog.resolveFallbackKey("grok-fast")).contains("nova-pro");
      assertThat(catalog.resolvePrimaryKey()).isEqualTo("nova-pro");
    }
  }
}
