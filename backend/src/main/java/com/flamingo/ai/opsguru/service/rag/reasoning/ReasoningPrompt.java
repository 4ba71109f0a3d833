package com.flamingo.ai.opsguru.service.rag.reasoning;

import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import com.flamingo.ai.opsguru.service.rag.retrieval.Citation;
import java.util.List;

/**
 * Everything a reasoning backend needs for one answer.
 *
 * @param systemPrompt domain instructions
 * @param userPrompt query, transformed query, context and telemetry
 * @param history prior turns with roles already coerced to user/assistant
 * @param turbineModel detected model name, may be null
 * @param citations sources behind the context, forwarded to external backends
 */
public record ReasoningPrompt(
    String systemPrompt,
    String userPrompt,
    List<ConversationTurn> history,
    String turbineModel,
    List<Citation> citations) {}
