package com.flamingo.ai.literatureingest.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INGESTION_ALREADY_RUNNING = "INGESTION_001";
  public static final String INGESTION_FATAL = "INGESTION_002";
  public static final String LEDGER_ERROR = "LEDGER_001";
  public static final String VECTOR_STORE_UNAVAILABLE = "STORE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  private final String message;

  /** Request path that caused the error. */
  private final String path;

  private final Instant timestamp;
}
