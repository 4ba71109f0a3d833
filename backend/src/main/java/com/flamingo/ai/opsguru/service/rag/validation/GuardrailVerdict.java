package com.flamingo.ai.opsguru.service.rag.validation;

/**
 * Raw verdict from a guardrail provider.
 *
 * @param status provider status, e.g. "passed" or "blocked"
 * @param compliant whether the answer may be delivered as is
 * @param compliance provider compliance code
 * @param details provider explanation
 */
public record GuardrailVerdict(
    String status, boolean compliant, String compliance, String details) {}
