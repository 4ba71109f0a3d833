package com.flamingo.ai.opsguru.service.rag.reasoning;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/**
 * Describes how the answer was produced.
 *
 * @param modelKey catalog key of the model that produced the answer, null if none did
 * @param displayName display name of that model
 * @param externalAttempted whether an external HTTP backend was called
 * @param fallbackUsed whether the fallback model was invoked
 * @param generatedAt time the answer was produced
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResponseMetadata(
    String modelKey,
    String displayName,
    boolean externalAttempted,
    boolean fallbackUsed,
    Instant generatedAt) {}
