package com.flamingo.ai.opsguru.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  public static final String SESSION_NOT_FOUND = "SESSION_001";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String MALFORMED_REQUEST = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
