package com.flamingo.ai.opsguru.service.rag.pipeline;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs the answering pipeline: query transformation, telemetry, retrieval, reasoning and
 * validation, strictly in that order. A stage that throws contributes an error entry and the run
 * continues with the next stage.
 */
@Service
@Slf4j
public class AgentWorkflow {

  private final List<PipelineStage> stages;
  private final MeterRegistry meterRegistry;

  @Autowired
  public AgentWorkflow(
      QueryTransformStage queryTransformStage,
      TelemetryStage telemetryStage,
      RetrievalStage retrievalStage,
      ReasoningStage reasoningStage,
      ValidationStage validationStage,
      MeterRegistry meterRegistry) {
    this(
        List.of(
            queryTransformStage, telemetryStage, retrievalStage, reasoningStage, validationStage),
        meterRegistry);
  }

  @VisibleForTesting
  AgentWorkflow(List<PipelineStage> stages, MeterRegistry meterRegistry) {
    this.stages = List.copyOf(stages);
    this.meterRegistry = meterRegistry;
  }

  @Timed(value = "pipeline.run", description = "Time to answer one query")
  public AgentState run(AgentState initial) {
    AgentState state = initial;
    for (PipelineStage stage : stages) {
      StateUpdate update;
      try {
        update = stage.apply(state);
      } catch (RuntimeException e) {
        log.error(
            "[{}] stage {} failed: {}", state.getSessionId(), stage.name(), e.getMessage(), e);
        meterRegistry.counter("pipeline.stage.errors", "stage", stage.name()).increment();
        update = StateUpdate.failed(stage.name() + ": " + e.getMessage());
      }
      state = state.merge(update);
      log.debug("[{}] stage {} done, errors so far: {}", state.getSessionId(), stage.name(),
          state.getErrors().size());
    }
    if (!state.getErrors().isEmpty()) {
      log.info("[{}] pipeline finished with {} errors: {}", state.getSessionId(),
          state.getErrors().size(), state.getErrors());
    }
    return state;
  }
}
