package com.flamingo.ai.opsguru.service.rag.validation;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.domain.enums.GuardrailStatus;
import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import com.flamingo.ai.opsguru.service.rag.retrieval.Citation;
import com.flamingo.ai.opsguru.service.rag.telemetry.DataPoint;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Gates the drafted answer. A non-compliant guardrail verdict replaces the text with {@link
 * #SAFE_REFUSAL_RESPONSE}; a confidence below the configured minimum appends {@link
 * #LOW_CONFIDENCE_WARNING}. Neither gate blocks the response.
 */
@Service
@Slf4j
public class ResponseValidator {

  public static final String SAFE_REFUSAL_RESPONSE =
      "I can't provide that guidance because it did not pass the safety review. Please follow your"
          + " site operating procedures and consult a qualified turbine engineer or the OEM"
          + " documentation.";

  public static final String LOW_CONFIDENCE_WARNING =
      "Note: this answer has low confidence because little supporting documentation was found."
          + " Verify it against the official maintenance manual before acting on it.";

  private final ConfidenceScorer confidenceScorer;
  private final Optional<GuardrailClient> guardrailClient;
  private final OpsGuruProperties properties;
  private final MeterRegistry meterRegistry;

  public ResponseValidator(
      ConfidenceScorer confidenceScorer,
      Optional<GuardrailClient> guardrailClient,
      OpsGuruProperties properties,
      MeterRegistry meterRegistry) {
    this.confidenceScorer = confidenceScorer;
    this.guardrailClient = guardrailClient;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  /** Scores the answer from its citations and telemetry, then applies both gates. */
  @Timed(value = "validation.validate", description = "Time to validate an answer")
  public ValidationResult validate(
      String draft, List<Citation> citations, List<DataPoint> dataPoints, TurbineModel model) {
    double confidence =
        confidenceScorer.score(citations, dataPoints != null && !dataPoints.isEmpty());
    return gate(draft, confidence, model);
  }

  /** Applies the guardrail and confidence gates to an already scored answer. */
  public ValidationResult gate(String draft, double confidence, TurbineModel model) {
    List<String> errors = new ArrayList<>();
    String response = draft == null ? "" : draft;
    GuardrailResult guardrailResult;

    if (guardrailClient.isEmpty()) {
      guardrailResult = GuardrailResult.skipped();
    } else {
      guardrailResult = runGuardrail(guardrailClient.get(), response, confidence, model, errors);
      if (guardrailResult.status() == GuardrailStatus.INTERVENED) {
        response = SAFE_REFUSAL_RESPONSE;
      }
    }

    double threshold = properties.getValidation().getMinConfidence();
    if (confidence < threshold) {
      log.warn("Answer confidence {} below threshold {}, adding warning", confidence, threshold);
      meterRegistry.counter("validation.low_confidence").increment();
      response = response + "\n\n" + LOW_CONFIDENCE_WARNING;
    }

    return new ValidationResult(response, confidence, guardrailResult, errors);
  }

  private GuardrailResult runGuardrail(
      GuardrailClient client,
      String response,
      double confidence,
      TurbineModel model,
      List<String> errors) {
    Map<String, String> context =
        Map.of(
            "confidence", String.valueOf(confidence),
            "turbine_model", model == null ? "unknown" : model.name());
    try {
      GuardrailVerdict verdict = client.evaluate(response, context);
      if (!verdict.compliant()) {
        log.warn(
            "Guardrail intervened: compliance={}, details={}",
            verdict.compliance(),
            verdict.details());
        meterRegistry.counter("guardrail.intervened").increment();
        return new GuardrailResult(
            GuardrailStatus.INTERVENED, verdict.compliance(), verdict.details());
      }
      return new GuardrailResult(GuardrailStatus.PASSED, verdict.compliance(), verdict.details());
    } catch (RuntimeException e) {
      log.warn("Guardrail evaluation failed, keeping draft answer: {}", e.getMessage());
      meterRegistry.counter("guardrail.errors").increment();
      errors.add("guardrail: " + e.getMessage());
      return GuardrailResult.error(e.getMessage());
    }
  }
}
