package com.flamingo.ai.opsguru.service.rag.telemetry;

import java.time.Instant;

/** One time-series reading from the telemetry gateway. */
public record DataPoint(Instant timestamp, String variable, double value, String unit) {}
