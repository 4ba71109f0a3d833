package com.flamingo.ai.opsguru.service.rag.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.exception.GuardrailException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@DisplayName("HttpGuardrailClient Tests")
class HttpGuardrailClientTest {

  private OpsGuruProperties properties;
  private MockEnvironment environment;

  @BeforeEach
  void setUp() {
    properties = new OpsGuruProperties();
    properties.getGuardrail().setProvider("http");
    properties.getGuardrail().setEndpoint("http://guardrail.local/evaluate");
    properties.getGuardrail().setApiKeyEnv("GUARDRAIL_KEY");
    environment = new MockEnvironment().withProperty("GUARDRAIL_KEY", "gk");
  }

  private HttpGuardrailClient client(
      HttpStatus status, String body, AtomicReference<ClientRequest> captured) {
    WebClient.Builder builder =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  captured.set(request);
                  return Mono.just(
                      ClientResponse.create(status)
                          .header("Content-Type", "application/json")
                          .body(body)
                          .build());
                });
    return new HttpGuardrailClient(builder, properties, environment);
  }

  @Test
  @DisplayName("Should report a passed verdict as compliant")
  void shouldReportCompliant() {
    AtomicReference<ClientRequest> captured = new AtomicReference<>();
    HttpGuardrailClient client =
        client(
            HttpStatus.OK,
            "{\"status\": \"passed\", \"compliance\": \"OK\", \"details\": \"fine\"}",
            captured);

    GuardrailVerdict verdict = client.evaluate("answer", Map.of("confidence", "0.9"));

    assertThat(verdict.compliant()).isTrue();
    assertThat(verdict.compliance()).isEqualTo("OK");
    assertThat(captured.get().headers().getFirst(HttpHeaders.AUTHORIZATION))
        .isEqualTo("Bearer gk");
  }

  @Test
  @DisplayName("Should report blocking statuses as non-compliant")
  void shouldReportNonCompliant() {
    HttpGuardrailClient client =
        client(
            HttpStatus.OK,
            "{\"status\": \"NON_COMPLIANT\", \"compliance\": \"UNSAFE\", \"score\": 0.1}",
            new AtomicReference<>());

    GuardrailVerdict verdict = client.evaluate("answer", Map.of());

    assertThat(verdict.compliant()).isFalse();
    assertThat(verdict.status()).isEqualTo("NON_COMPLIANT");
  }

  @Test
  @DisplayName("Should fail when the service returns no status")
  void shouldFailWithoutStatus() {
    HttpGuardrailClient client = client(HttpStatus.OK, "{}", new AtomicReference<>());

    assertThatThrownBy(() -> client.evaluate("answer", Map.of()))
        .isInstanceOf(GuardrailException.class)
        .hasMessage("Guardrail returned no verdict");
  }

  @Test
  @DisplayName("Should wrap HTTP errors")
  void shouldWrapHttpErrors() {
    HttpGuardrailClient client =
        client(HttpStatus.INTERNAL_SERVER_ERROR, "{}", new AtomicReference<>());

    assertThatThrownBy(() -> client.evaluate("answer", Map.of()))
        .isInstanceOf(GuardrailException.class)
        .hasMessageStartingWith("Guardrail call failed");
  }

  @Test
  @DisplayName("Should fail fast without an endpoint")
  void shouldFailWithoutEndpoint() {
    properties.getGuardrail().setEndpoint(null);
    HttpGuardrailClient client = client(HttpStatus.OK, "{}", new AtomicReference<>());

    assertThatThrownBy(() -> client.evaluate("answer", Map.of()))
        .isInstanceOf(GuardrailException.class)
        .hasMessage("Guardrail endpoint is not configured");
  }
}
