package com.flamingo.ai.opsguru.service.rag.telemetry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.domain.enums.DataFetchStatus;
import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import com.flamingo.ai.opsguru.exception.TelemetryException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("TelemetryService Tests")
class TelemetryServiceTest {

  @Mock private TelemetryClient telemetryClient;

  private OpsGuruProperties properties;
  private TelemetryService telemetryService;

  @BeforeEach
  void setUp() {
    properties = new OpsGuruProperties();
    telemetryService =
        new TelemetryService(telemetryClient, properties, new SimpleMeterRegistry());
  }

  @Test
  @DisplayName("Should skip the gateway when telemetry is disabled")
  void shouldSkipWhenDisabled() {
    TelemetryResult result = telemetryService.fetchRecent(TurbineModel.SMT60);

    assertThat(result.status()).isEqualTo(DataFetchStatus.DISABLED);
    assertThat(result.dataPoints()).isEmpty();
    assertThat(result.error()).isNull();
    verifyNoInteractions(telemetryClient);
  }

  @Test
  @DisplayName("Should skip the gateway when enabled without an endpoint")
  void shouldSkipWithoutEndpoint() {
    properties.getTelemetry().setEnabled(true);

    assertThat(telemetryService.fetchRecent(TurbineModel.SMT60).status())
        .isEqualTo(DataFetchStatus.DISABLED);
    verifyNoInteractions(telemetryClient);
  }

  @Test
  @DisplayName("Should return readings when the gateway answers")
  void shouldReturnReadings() {
    properties.getTelemetry().setEnabled(true);
    properties.getTelemetry().setEndpoint("http://telemetry.local");
    DataPoint point = new DataPoint(Instant.now(), "oil_pressure", 1.8, "bar");
    when(telemetryClient.fetch(
            "http://telemetry.local",
            TurbineModel.SMT60,
            List.of("oil_pressure", "exhaust_temp"),
            60))
        .thenReturn(List.of(point));

    TelemetryResult result = telemetryService.fetchRecent(TurbineModel.SMT60);

    assertThat(result.status()).isEqualTo(DataFetchStatus.OK);
    assertThat(result.dataPoints()).containsExactly(point);
  }

  @Test
  @DisplayName("Should report an error status when the gateway fails")
  void shouldReportGatewayFailure() {
    properties.getTelemetry().setEnabled(true);
    properties.getTelemetry().setEndpoint("http://telemetry.local");
    when(telemetryClient.fetch(anyString(), any(), anyList(), anyInt()))
        .thenThrow(new TelemetryException("Telemetry gateway call failed: timeout", null));

    TelemetryResult result = telemetryService.fetchRecent(TurbineModel.SMT60);

    assertThat(result.status()).isEqualTo(DataFetchStatus.ERROR);
    assertThat(result.dataPoints()).isEmpty();
    assertThat(result.error()).isEqualTo("telemetry: Telemetry gateway call failed: timeout");
  }

  @Test
  @DisplayName("Should drop null readings returned by the gateway")
  void shouldDropNullReadings() {
    properties.getTelemetry().setEnabled(true);
    properties.getTelemetry().setEndpoint("http://telemetry.local");
    DataPoint point = new DataPoint(Instant.now(), "exhaust_temp", 512.0, "C");
    when(telemetryClient.fetch(anyString(), any(), anyList(), anyInt()))
        .thenReturn(Arrays.asList(null, point, null));

    TelemetryResult result = telemetryService.fetchRecent(TurbineModel.SMT60);

    assertThat(result.status()).isEqualTo(DataFetchStatus.OK);
    assertThat(result.dataPoints()).containsExactly(point);
  }

  @Test
  @DisplayName("Should report an error status on unexpected failures")
  void shouldReportUnexpectedFailure() {
    properties.getTelemetry().setEnabled(true);
    properties.getTelemetry().setEndpoint("http://telemetry.local");
    when(telemetryClient.fetch(anyString(), any(), anyList(), anyInt()))
        .thenThrow(new IllegalStateException("decoder closed"));

    TelemetryResult result = telemetryService.fetchRecent(TurbineModel.SMT60);

    assertThat(result.status()).isEqualTo(DataFetchStatus.ERROR);
    assertThat(result.error()).isEqualTo("telemetry: decoder closed");
  }
}
