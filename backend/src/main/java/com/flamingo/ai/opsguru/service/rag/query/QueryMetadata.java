package com.flamingo.ai.opsguru.service.rag.query;

import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import java.time.Instant;
import java.util.List;

/**
 * Metadata derived from the operator query.
 *
 * @param turbineModel detected model, null when none was mentioned
 * @param language "en" or "unknown-non-ascii"
 * @param timestamp time the query was transformed (UTC)
 * @param recentUserTurns up to the last three user turns, oldest first
 */
public record QueryMetadata(
    TurbineModel turbineModel, String language, Instant timestamp, List<String> recentUserTurns) {}
