package com.flamingo.ai.literatureingest.retry;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Structured logging for retry events.
 *
 * <p>MDC keys set while logging: {@code retry.operation}, {@code retry.attempt}, {@code
 * retry.exception}.
 */
@Component
@Slf4j
public class RetryEventLogger {

  private static final String MDC_RETRY_OPERATION = "retry.operation";
  private static final String MDC_RETRY_ATTEMPT = "retry.attempt";
  private static final String MDC_RETRY_EXCEPTION = "retry.exception";
  private static final int MAX_MESSAGE_LENGTH = 200;

  public void logRetryAttempt(
      String operation, int attempt, int maxAttempts, long waitMillis, Throwable failure) {
    String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
    try {
      putContext(operation, attempt, exceptionName);
      log.info(
          "Retry attempt {}/{} for {} in {} ms: {} - {}",
          attempt,
          maxAttempts,
          operation,
          waitMillis,
          exceptionName,
          truncate(failure != null ? failure.getMessage() : null));
    } finally {
      clearContext();
    }
  }

  public void logRetryExhausted(String operation, int totalAttempts, Throwable failure) {
    String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
    try {
      putContext(operation, totalAttempts, exceptionName);
      log.warn(
          "Retry exhausted for {} after {} attempts: {} - {}",
          operation,
          totalAttempts,
          exceptionName,
          truncate(failure != null ? failure.getMessage() : null));
    } finally {
      clearContext();
    }
  }

  public void logRetrySuccess(String operation, int totalAttempts) {
    if (totalAttempts <= 1) {
      return;
    }
    try {
      MDC.put(MDC_RETRY_OPERATION, operation);
      MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));
      log.info("Retry succeeded for {} on attempt {}", operation, totalAttempts);
    } finally {
      clearContext();
    }
  }

  private void putContext(String operation, int attempt, String exceptionName) {
    MDC.put(MDC_RETRY_OPERATION, operation);
    MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(attempt));
    MDC.put(MDC_RETRY_EXCEPTION, exceptionName);
  }

  private void clearContext() {
    MDC.remove(MDC_RETRY_OPERATION);
    MDC.remove(MDC_RETRY_ATTEMPT);
    MDC.remove(MDC_RETRY_EXCEPTION);
  }

  private String truncate(String message) {
    if (message == null) {
      return "null";
    }
    return message.length() <= MAX_MESSAGE_LENGTH
        ? message
        : message.substring(0, MAX_MESSAGE_LENGTH) + "...";
  }
}
