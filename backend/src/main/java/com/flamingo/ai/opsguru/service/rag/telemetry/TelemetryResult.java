package com.flamingo.ai.opsguru.service.rag.telemetry;

import com.flamingo.ai.opsguru.domain.enums.DataFetchStatus;
import java.util.List;
import java.util.Objects;

/** Readings returned by the telemetry stage together with the fetch status. */
public record TelemetryResult(DataFetchStatus status, List<DataPoint> dataPoints, String error) {

  public static TelemetryResult disabled() {
    return new TelemetryResult(DataFetchStatus.DISABLED, List.of(), null);
  }

  public static TelemetryResult ok(List<DataPoint> dataPoints) {
    List<DataPoint> readings =
        dataPoints == null ? List.of() : dataPoints.stream().filter(Objects::nonNull).toList();
    return new TelemetryResult(DataFetchStatus.OK, readings, null);
  }

  public static TelemetryResult error(String error) {
    return new TelemetryResult(DataFetchStatus.ERROR, List.of(), error);
  }
}
