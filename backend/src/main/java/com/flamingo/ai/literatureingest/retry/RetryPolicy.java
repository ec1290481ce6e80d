package com.flamingo.ai.literatureingest.retry;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retry settings for one operation: attempts, exponential backoff bounds, jitter and which
 * failures are retryable.
 *
 * @param name operation name, used for the Resilience4j instance and in logs
 * @param maxAttempts total attempts including the first call
 * @param baseDelay wait before the first retry; doubles on every further retry
 * @param maxDelay upper bound on a single wait
 * @param jitter randomization factor in [0, 1)
 * @param retryable failures worth another attempt
 */
public record RetryPolicy(
    String name,
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    double jitter,
    Predicate<Throwable> retryable) {

  private static final double BACKOFF_MULTIPLIER = 2.0;

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1)");
    }
  }

  public static RetryPolicy of(
      String name, IngestionConfig.Policy settings, Predicate<Throwable> retryable) {
    return new RetryPolicy(
        name,
        settings.getMaxAttempts(),
        settings.getBaseDelay(),
        settings.getMaxDelay(),
        settings.getJitter(),
        retryable);
  }

  public RetryConfig toRetryConfig() {
    IntervalFunction backoff =
        jitter > 0.0
            ? IntervalFunction.ofExponentialRandomBackoff(
                baseDelay, BACKOFF_MULTIPLIER, jitter, maxDelay)
            : IntervalFunction.ofExponentialBackoff(baseDelay, BACKOFF_MULTIPLIER, maxDelay);
    return RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalFunction(backoff)
        .retryOnException(retryable)
        .build();
  }
}
