package com.flamingo.ai.opsguru.service.rag.reasoning;

/** Sampling settings passed with each reasoning request. */
public record InferenceParameters(int maxTokens, double temperature) {

  public static final InferenceParameters DEFAULT = new InferenceParameters(2048, 0.7);
}
