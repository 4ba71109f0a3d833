package com.flamingo.ai.opsguru.service.rag.pipeline;

import com.flamingo.ai.opsguru.service.rag.telemetry.TelemetryResult;
import com.flamingo.ai.opsguru.service.rag.telemetry.TelemetryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Adds recent telemetry readings when the feature is enabled. */
@Component
@RequiredArgsConstructor
public class TelemetryStage implements PipelineStage {

  private final TelemetryService telemetryService;

  @Override
  public String name() {
    return "telemetry";
  }

  @Override
  public StateUpdate apply(AgentState state) {
    TelemetryResult result = telemetryService.fetchRecent(state.getTurbineModel());
    StateUpdate.StateUpdateBuilder update =
        StateUpdate.builder().dataPoints(result.dataPoints()).dataFetchStatus(result.status());
    if (result.error() != null) {
      update.error(result.error());
    }
    return update.build();
  }
}
