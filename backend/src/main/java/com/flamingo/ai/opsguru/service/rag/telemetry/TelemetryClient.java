package com.flamingo.ai.opsguru.service.rag.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import com.flamingo.ai.opsguru.exception.TelemetryException;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for the plant telemetry gateway. */
@Component
@Slf4j
public class TelemetryClient {

  private final WebClient webClient;
  private final int timeoutMs;

  public TelemetryClient(WebClient.Builder webClientBuilder, OpsGuruProperties properties) {
    this.timeoutMs = properties.getTelemetry().getTimeoutMs();
    this.webClient =
        webClientBuilder
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
  }

  /**
   * Fetches recent readings for a turbine.
   *
   * @param endpoint gateway URL
   * @param turbineModel model the readings are for, may be null
   * @param variables variables to read
   * @param lookbackMinutes how far back to read
   * @return readings in gateway order, never null
   * @throws TelemetryException on transport errors or timeout
   */
  public List<DataPoint> fetch(
      String endpoint, TurbineModel turbineModel, List<String> variables, int lookbackMinutes) {
    var request =
        new TelemetryRequest(
            turbineModel == null ? null : turbineModel.name(), variables, lookbackMinutes);
    try {
      TelemetryResponse response =
          webClient
              .post()
              .uri(endpoint)
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(request)
              .retrieve()
              .bodyToMono(TelemetryResponse.class)
              .timeout(Duration.ofMillis(timeoutMs))
              .block();
      if (response == null || response.dataPoints() == null) {
        return List.of();
      }
      return response.dataPoints();
    } catch (RuntimeException e) {
      throw new TelemetryException("Telemetry gateway call failed: " + e.getMessage(), e);
    }
  }

  record TelemetryRequest(
      @JsonProperty("turbine_model") String turbineModel,
      List<String> variables,
      @JsonProperty("lookback_minutes") int lookbackMinutes) {}

  record TelemetryResponse(@JsonProperty("data_points") List<DataPoint> dataPoints) {}
}
