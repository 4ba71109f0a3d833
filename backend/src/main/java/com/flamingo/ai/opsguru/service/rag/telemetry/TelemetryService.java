package com.flamingo.ai.opsguru.service.rag.telemetry;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reads recent turbine telemetry when the feature is enabled. Never throws: gateway failures are
 * reported through the {@link TelemetryResult} status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TelemetryService {

  private final TelemetryClient telemetryClient;
  private final OpsGuruProperties properties;
  private final MeterRegistry meterRegistry;

  @Timed(value = "telemetry.fetch", description = "Time to fetch turbine telemetry")
  public TelemetryResult fetchRecent(TurbineModel turbineModel) {
    OpsGuruProperties.Telemetry config = properties.getTelemetry();
    if (!config.isEnabled() || config.getEndpoint() == null || config.getEndpoint().isBlank()) {
      log.debug("Telemetry disabled, skipping fetch");
      return TelemetryResult.disabled();
    }

    try {
      List<DataPoint> dataPoints =
          telemetryClient.fetch(
              config.getEndpoint(),
              turbineModel,
              config.getVariables(),
              config.getLookbackMinutes());
      TelemetryResult result = TelemetryResult.ok(dataPoints);
      meterRegistry.counter("telemetry.fetch.success").increment();
      log.info(
          "Fetched {} telemetry data points for {}", result.dataPoints().size(), turbineModel);
      return result;
    } catch (RuntimeException e) {
      meterRegistry.counter("telemetry.fetch.failure").increment();
      log.warn("Telemetry fetch failed for {}: {}", turbineModel, e.getMessage());
      return TelemetryResult.error("telemetry: " + e.getMessage());
    }
  }
}
