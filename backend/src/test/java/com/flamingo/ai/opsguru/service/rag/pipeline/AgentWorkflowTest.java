package com.flamingo.ai.opsguru.service.rag.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.domain.enums.DataFetchStatus;
import com.flamingo.ai.opsguru.domain.enums.GuardrailStatus;
import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import com.flamingo.ai.opsguru.elasticsearch.SearchIndexClient;
import com.flamingo.ai.opsguru.exception.SearchException;
import com.flamingo.ai.opsguru.service.rag.detection.TurbineModelDetector;
import com.flamingo.ai.opsguru.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.opsguru.service.rag.query.QueryTransformer;
import com.flamingo.ai.opsguru.service.rag.reasoning.ExternalReasoningClient;
import com.flamingo.ai.opsguru.service.rag.reasoning.ManagedLlmClient;
import com.flamingo.ai.opsguru.service.rag.reasoning.ModelCatalog;
import com.flamingo.ai.opsguru.service.rag.reasoning.PromptBuilder;
import com.flamingo.ai.opsguru.service.rag.reasoning.ReasoningEngine;
import com.flamingo.ai.opsguru.service.rag.reasoning.ReasoningPrompt;
import com.flamingo.ai.opsguru.service.rag.retrieval.CitationFormatter;
import com.flamingo.ai.opsguru.service.rag.retrieval.HierarchicalContextAssembler;
import com.flamingo.ai.opsguru.service.rag.retrieval.KnowledgeRetriever;
import com.flamingo.ai.opsguru.service.rag.retrieval.RetrievalHit;
import com.flamingo.ai.opsguru.service.rag.telemetry.TelemetryClient;
import com.flamingo.ai.opsguru.service.rag.telemetry.TelemetryService;
import com.flamingo.ai.opsguru.service.rag.validation.ConfidenceScorer;
import com.flamingo.ai.opsguru.service.rag.validation.ResponseValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("AgentWorkflow Tests")
class AgentWorkflowTest {

  private static final String QUERY = "How do I troubleshoot low oil pressure on the SMT60?";
  private static final String ANSWER =
      "Check the lube oil level, then the relief valve setting [smt60-manual.pdf, p. 12].";

  @Mock private EmbeddingService embeddingService;
  @Mock private SearchIndexClient searchIndexClient;
  @Mock private TelemetryClient telemetryClient;
  @Mock private ManagedLlmClient managedLlmClient;
  @Mock private ExternalReasoningClient externalReasoningClient;

  private OpsGuruProperties properties;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    properties = new OpsGuruProperties();
    meterRegistry = new SimpleMeterRegistry();
  }

  private AgentWorkflow workflow() {
    return new AgentWorkflow(
        new QueryTransformStage(new QueryTransformer(new TurbineModelDetector(properties))),
        new TelemetryStage(new TelemetryService(telemetryClient, properties, meterRegistry)),
        new RetrievalStage(
            new KnowledgeRetriever(
                embeddingService,
                searchIndexClient,
                new HierarchicalContextAssembler(properties),
                new CitationFormatter(properties, (source, page) -> null),
                properties,
                meterRegistry)),
        new ReasoningStage(
            new ReasoningEngine(
                new ModelCatalog(properties, "gpt-4o-mini"),
                new PromptBuilder(new ObjectMapper().findAndRegisterModules(), properties),
                managedLlmClient,
                externalReasoningClient,
                meterRegistry)),
        new ValidationStage(
            new ResponseValidator(
                new ConfidenceScorer(properties), Optional.empty(), properties, meterRegistry)),
        meterRegistry);
  }

  private static AgentState initial() {
    return AgentState.builder().sessionId("session-0123456789ab").query(QUERY).build();
  }

  private static RetrievalHit hit(String id, double score, int chunkIndex) {
    return new RetrievalHit(
        id,
        "Low lube oil pressure: verify oil level and relief valve.",
        "smt60-manual.pdf",
        score,
        12,
        "Lube Oil > Pressure",
        "smt60-manual",
        chunkIndex,
        "SMT60",
        "manual",
        List.of());
  }

  @Nested
  @DisplayName("Scenarios")
  class Scenarios {

    @Test
    @DisplayName("Healthy system: model detected, cited answer, no errors")
    void shouldAnswerOnHealthySystem() {
      when(embeddingService.embedQuery(anyString())).thenReturn(List.of(0.1f, 0.2f));
      when(searchIndexClient.hybridSearch(anyString(), anyList(), anyMap(), anyInt()))
          .thenReturn(
              List.of(hit("smt60-manual_chunk_4", 8.0, 4), hit("smt60-manual_chunk_9", 4.0, 9)));
      when(searchIndexClient.getByIds(anyList())).thenReturn(List.of());
      when(managedLlmClient.invoke(eq("nova-pro"), any(), any())).thenReturn(ANSWER);

      AgentState result = workflow().run(initial());

      assertThat(result.getTurbineModel()).isEqualTo(TurbineModel.SMT60);
      assertThat(result.getTransformedQuery()).endsWith("(turbine model: SMT60)");
      assertThat(result.getDataFetchStatus()).isEqualTo(DataFetchStatus.DISABLED);
      assertThat(result.getCitations()).hasSize(2);
      assertThat(result.getCitations().get(0).relevanceScore()).isEqualTo(1.0);
      assertThat(result.getConfidenceScore()).isBetween(0.4, 0.98);
      assertThat(result.getLlmResponse()).isEqualTo(ANSWER);
      assertThat(result.getGuardrailResult().status()).isEqualTo(GuardrailStatus.SKIPPED);
      assertThat(result.getResponseMetadata().modelKey()).isEqualTo("nova-pro");
      assertThat(result.getErrors()).isEmpty();
      verify(searchIndexClient)
          .hybridSearch(
              eq(QUERY + " (turbine model: SMT60)"),
              anyList(),
              eq(Map.of("turbine_model", "SMT60")),
              eq(5));
      verifyNoInteractions(telemetryClient);
    }

    @Test
    @DisplayName("Index unreachable: sentinel context, retrieval error, answer still produced")
    void shouldDegradeWhenIndexIsUnreachable() {
      when(embeddingService.embedQuery(anyString())).thenReturn(List.of(0.1f, 0.2f));
      when(searchIndexClient.hybridSearch(anyString(), anyList(), anyMap(), anyInt()))
          .thenThrow(new SearchException("Hybrid search unavailable: Connection refused"));
      when(managedLlmClient.invoke(eq("nova-pro"), any(), any())).thenReturn(ANSWER);

      AgentState result = workflow().run(initial());

      assertThat(result.getCitations()).isEmpty();
      assertThat(result.getHierarchicalContext())
          .isEqualTo(HierarchicalContextAssembler.NO_RESULTS_CONTEXT);
      assertThat(result.getErrors())
          .containsExactly("retrieval: Hybrid search unavailable: Connection refused");
      assertThat(result.getLlmResponse()).isNotBlank().startsWith(ANSWER);

      ArgumentCaptor<ReasoningPrompt> prompt = ArgumentCaptor.forClass(ReasoningPrompt.class);
      verify(managedLlmClient).invoke(eq("nova-pro"), any(), prompt.capture());
      assertThat(prompt.getValue().userPrompt())
          .contains(HierarchicalContextAssembler.NO_RESULTS_CONTEXT);
    }

    @Test
    @DisplayName("Low confidence: warning suffix appended to the answer")
    void shouldWarnOnLowConfidence() {
      properties.getValidation().setNoCitationConfidence(0.2);
      properties.getValidation().setMinConfidence(0.75);
      when(embeddingService.embedQuery(anyString())).thenReturn(List.of(0.1f, 0.2f));
      when(searchIndexClient.hybridSearch(anyString(), anyList(), anyMap(), anyInt()))
          .thenReturn(List.of());
      when(managedLlmClient.invoke(eq("nova-pro"), any(), any())).thenReturn(ANSWER);

      AgentState result = workflow().run(initial());

      assertThat(result.getConfidenceScore()).isEqualTo(0.2);
      assertThat(result.getLlmResponse())
          .isEqualTo(ANSWER + "\n\n" + ResponseValidator.LOW_CONFIDENCE_WARNING);
      assertThat(result.getErrors()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Resilience")
  class Resilience {

    @Test
    @DisplayName("Null turns in the history are ignored by every stage")
    void shouldIgnoreNullHistoryTurns() {
      when(embeddingService.embedQuery(anyString())).thenReturn(List.of(0.1f, 0.2f));
      when(searchIndexClient.hybridSearch(anyString(), anyList(), anyMap(), anyInt()))
          .thenReturn(List.of());
      when(managedLlmClient.invoke(eq("nova-pro"), any(), any())).thenReturn(ANSWER);
      AgentState withNullTurns =
          initial().toBuilder()
              .messages(
                  Arrays.asList(
                      null,
                      ConversationTurn.user("The SMT60 tripped this morning.", Instant.now()),
                      null))
              .build();

      AgentState result = workflow().run(withNullTurns);

      assertThat(result.getTurbineModel()).isEqualTo(TurbineModel.SMT60);
      assertThat(result.getQueryMetadata().recentUserTurns())
          .containsExactly("The SMT60 tripped this morning.");
      assertThat(result.getLlmResponse()).startsWith(ANSWER);
      assertThat(result.getResponseMetadata().modelKey()).isEqualTo("nova-pro");
      assertThat(result.getErrors()).isEmpty();

      ArgumentCaptor<ReasoningPrompt> prompt = ArgumentCaptor.forClass(ReasoningPrompt.class);
      verify(managedLlmClient).invoke(eq("nova-pro"), any(), prompt.capture());
      assertThat(prompt.getValue().history()).hasSize(1);
    }

    @Test
    @DisplayName("An unexpected reasoning crash still returns the failure response")
    void shouldReturnFailureResponseWhenReasoningCrashes() {
      when(embeddingService.embedQuery(anyString())).thenReturn(List.of(0.1f, 0.2f));
      when(searchIndexClient.hybridSearch(anyString(), anyList(), anyMap(), anyInt()))
          .thenReturn(List.of());
      when(managedLlmClient.invoke(anyString(), any(), any()))
          .thenThrow(new IllegalStateException("client not initialised"));

      AgentState result = workflow().run(initial());

      assertThat(result.getLlmResponse()).startsWith(ReasoningEngine.FAILURE_RESPONSE);
      assertThat(result.getErrors()).containsExactly("reasoning: client not initialised");
      assertThat(result.getConfidenceScore()).isNotNull();
    }
  }

  @Test
  @DisplayName("Should record a failing stage and keep running the rest")
  void shouldContinueAfterStageFailure() {
    PipelineStage failing = mock(PipelineStage.class);
    when(failing.name()).thenReturn("telemetry");
    when(failing.apply(any())).thenThrow(new IllegalStateException("gateway misconfigured"));
    PipelineStage answering = mock(PipelineStage.class);
    when(answering.name()).thenReturn("reasoning");
    when(answering.apply(any())).thenReturn(StateUpdate.builder().llmResponse("answer").build());

    AgentState result =
        new AgentWorkflow(List.of(failing, answering), meterRegistry).run(initial());

    assertThat(result.getLlmResponse()).isEqualTo("answer");
    assertThat(result.getErrors()).containsExactly("telemetry: gateway misconfigured");
    assertThat(meterRegistry.counter("pipeline.stage.errors", "stage", "telemetry").count())
        .isEqualTo(1.0);
  }
}
