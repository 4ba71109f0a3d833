package com.flamingo.ai.opsguru.agent.dto;

/**
 * Structured output from ContentSafetyAgent. LangChain4j deserializes the model's JSON reply into
 * this record.
 */
public record SafetyAssessment(
    boolean compliant,
    String complianceCode, // e.g. "OK", "UNSAFE_PROCEDURE", "BYPASS_INTERLOCK"
    String reason) {}
