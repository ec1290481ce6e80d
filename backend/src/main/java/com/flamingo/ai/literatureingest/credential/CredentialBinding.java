package com.flamingo.ai.literatureingest.credential;

import com.flamingo.ai.literatureingest.domain.model.Credential;
import com.google.common.base.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/** A credential together with its own rate limiter and request accounting. */
public class CredentialBinding {

  private final Credential credential;
  private final MinIntervalRateLimiter rateLimiter;
  private final MeterRegistry meterRegistry;
  private final Ticker ticker;
  private final AtomicLong requests = new AtomicLong();
  private final AtomicLong firstRequestNanos = new AtomicLong(-1);

  public CredentialBinding(
      Credential credential,
      MinIntervalRateLimiter rateLimiter,
      MeterRegistry meterRegistry,
      Ticker ticker) {
    this.credential = credential;
    this.rateLimiter = rateLimiter;
    this.meterRegistry = meterRegistry;
    this.ticker = ticker;
  }

  /**
   * Waits for this credential's next request slot and counts the request.
   *
   * @param operation the API operation about to be called, used as a metric tag
   */
  public void acquire(String operation) {
    rateLimiter.acquire();
    firstRequestNanos.compareAndSet(-1, ticker.read());
    requests.incrementAndGet();
    meterRegistry
        .counter("ingestion.api.requests", "credential", credential.id(), "operation", operation)
        .increment();
  }

  public Credential getCredential() {
    return credential;
  }

  public String getId() {
    return credential.id();
  }

  public long getRequestCount() {
    return requests.get();
  }

  /** Average requests per second since this credential's first request. */
  public double getRequestsPerSecond() {
    long first = firstRequestNanos.get();
    long count = requests.get();
    if (first < 0 || count < 2) {
      return 0.0;
    }
    double elapsedSeconds = (ticker.read() - first) / (double) TimeUnit.SECONDS.toNanos(1);
    return elapsedSeconds <= 0 ? 0.0 : count / elapsedSeconds;
  }
}
