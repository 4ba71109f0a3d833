package com.flamingo.ai.opsguru.service.rag.validation;

import com.flamingo.ai.opsguru.exception.GuardrailException;
import java.util.Map;

/** Content-safety check applied to a drafted answer. */
public interface GuardrailClient {

  /**
   * Evaluates a drafted answer.
   *
   * @param text the draft answer
   * @param context attributes such as {@code confidence} and {@code turbine_model}
   * @return the verdict
   * @throws GuardrailException if the answer could not be evaluated
   */
  GuardrailVerdict evaluate(String text, Map<String, String> context);
}
