package com.flamingo.ai.literatureingest.exception;

import java.time.Duration;

/** Exception thrown when a call to the bibliographic source returns an error response. */
public class LiteratureApiException extends RuntimeException {

  private final String operation;
  private final int statusCode;
  private final Duration retryAfter;

  public LiteratureApiException(String operation, int statusCode, String message) {
    this(operation, statusCode, message, null);
  }

  public LiteratureApiException(
      String operation, int statusCode, String message, Duration retryAfter) {
    super(operation + " failed with HTTP " + statusCode + ": " + message);
    this.operation = operation;
    this.statusCode = statusCode;
    this.retryAfter = retryAfter;
  }

  public String getOperation() {
    return operation;
  }

  public int getStatusCode() {
    return statusCode;
  }

  /** Server-suggested wait from a {@code Retry-After} header, or null. */
  public Duration getRetryAfter() {
    return retryAfter;
  }

  public boolean isRateLimited() {
    return statusCode == 429;
  }

  public boolean isServerError() {
    return statusCode >= 500;
  }

  public boolean isRetryable() {
    return isRateLimited() || isServerError();
  }
}
