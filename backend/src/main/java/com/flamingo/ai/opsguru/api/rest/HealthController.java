package com.flamingo.ai.opsguru.api.rest;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.service.rag.reasoning.ModelCatalog;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and configuration info. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final ModelCatalog modelCatalog;
  private final OpsGuruProperties properties;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "UP");
    health.put("timestamp", Instant.now());
    health.put("service", "opsguru");
    health.put("model", modelCatalog.resolvePrimaryKey());
    health.put("telemetry_enabled", properties.getTelemetry().isEnabled());
    health.put("guardrail_provider", properties.getGuardrail().getProvider());
    return ResponseEntity.ok(health);
  }
}
