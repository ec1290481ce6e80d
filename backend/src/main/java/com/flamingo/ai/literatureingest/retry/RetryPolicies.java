package com.flamingo.ai.literatureingest.retry;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.domain.enums.FailureCategory;
import com.flamingo.ai.literatureingest.exception.FatalIngestionException;
import com.flamingo.ai.literatureingest.exception.IngestionInterruptedException;
import com.flamingo.ai.literatureingest.pipeline.IngestionStats;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The four retry instances used by the pipeline, built from {@code ingestion.retry.*}.
 *
 * <p>HTTP operations retry transient and rate-limit failures only. Index writes retry everything
 * except fatal errors and interruption.
 */
@Component
@Slf4j
public class RetryPolicies {

  public static final String SEARCH = "ingestion-search";
  public static final String FETCH = "ingestion-fetch";
  public static final String FULL_TEXT = "ingestion-full-text";
  public static final String INDEX = "ingestion-index";

  static final Predicate<Throwable> INDEX_RETRYABLE =
      t -> !(t instanceof FatalIngestionException || t instanceof IngestionInterruptedException);

  private final Retry search;
  private final Retry fetch;
  private final Retry fullText;
  private final Retry index;
  private final RetryEventLogger retryEventLogger;
  private final IngestionStats ingestionStats;

  public RetryPolicies(
      RetryRegistry retryRegistry,
      IngestionConfig ingestionConfig,
      RetryEventLogger retryEventLogger,
      IngestionStats ingestionStats) {
    this.retryEventLogger = retryEventLogger;
    this.ingestionStats = ingestionStats;
    IngestionConfig.Retry settings = ingestionConfig.getRetry();
    this.search =
        register(
            retryRegistry,
            RetryPolicy.of(SEARCH, settings.getSearch(), TransientErrorPredicate.INSTANCE));
    this.fetch =
        register(
            retryRegistry,
            RetryPolicy.of(FETCH, settings.getFetch(), TransientErrorPredicate.INSTANCE));
    this.fullText =
        register(
            retryRegistry,
            RetryPolicy.of(FULL_TEXT, settings.getFullText(), TransientErrorPredicate.INSTANCE));
    this.index =
        register(retryRegistry, RetryPolicy.of(INDEX, settings.getIndex(), INDEX_RETRYABLE));
  }

  public Retry search() {
    return search;
  }

  public Retry fetch() {
    return fetch;
  }

  public Retry fullText() {
    return fullText;
  }

  public Retry index() {
    return index;
  }

  private Retry register(RetryRegistry registry, RetryPolicy policy) {
    registry.remove(policy.name());
    Retry retry = registry.retry(policy.name(), policy.toRetryConfig());
    int maxAttempts = policy.maxAttempts();
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              FailureCategory category =
                  TransientErrorPredicate.categorize(event.getLastThrowable());
              ingestionStats.retryScheduled(category);
              retryEventLogger.logRetryAttempt(
                  event.getName(),
                  event.getNumberOfRetryAttempts(),
                  maxAttempts,
                  event.getWaitInterval().toMillis(),
                  event.getLastThrowable());
            })
        .onError(
            event ->
                retryEventLogger.logRetryExhausted(
                    event.getName(), event.getNumberOfRetryAttempts(), event.getLastThrowable()))
        .onSuccess(
            event ->
                retryEventLogger.logRetrySuccess(
                    event.getName(), event.getNumberOfRetryAttempts() + 1));
    log.debug(
        "Registered retry {}: maxAttempts={}, baseDelay={}, maxDelay={}",
        policy.name(),
        maxAttempts,
        policy.baseDelay(),
        policy.maxDelay());
    return retry;
  }
}
