package com.flamingo.ai.literatureingest.credential;

import com.flamingo.ai.literatureingest.exception.IngestionInterruptedException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import java.util.concurrent.TimeUnit;

/**
 * Rate limiter that spaces requests at least {@code 1 / requestsPerSecond} apart.
 *
 * <p>There is no burst allowance: an idle limiter admits one request immediately and every further
 * request waits for its own slot. Slots are reserved under a lock before sleeping, so concurrent
 * callers are spaced as well.
 */
public class MinIntervalRateLimiter {

  /** Blocks the calling thread for the given number of nanoseconds. */
  @FunctionalInterface
  public interface Sleeper {
    Sleeper SYSTEM = TimeUnit.NANOSECONDS::sleep;

    void sleepNanos(long nanos) throws InterruptedException;
  }

  private final long intervalNanos;
  private final Ticker ticker;
  private final Sleeper sleeper;
  private final Object lock = new Object();

  private boolean idle = true;
  private long nextSlotNanos;

  public MinIntervalRateLimiter(double requestsPerSecond) {
    this(requestsPerSecond, Ticker.systemTicker(), Sleeper.SYSTEM);
  }

  @VisibleForTesting
  MinIntervalRateLimiter(double requestsPerSecond, Ticker ticker, Sleeper sleeper) {
    if (requestsPerSecond <= 0) {
      throw new IllegalArgumentException("requestsPerSecond must be positive");
    }
    this.intervalNanos = (long) Math.ceil(TimeUnit.SECONDS.toNanos(1) / requestsPerSecond);
    this.ticker = ticker;
    this.sleeper = sleeper;
  }

  /** Blocks until one more request fits under the ceiling. */
  public void acquire() {
    long waitNanos;
    synchronized (lock) {
      long now = ticker.read();
      long slot = idle ? now : Math.max(now, nextSlotNanos);
      idle = false;
      nextSlotNanos = slot + intervalNanos;
      waitNanos = slot - now;
    }
    if (waitNanos > 0) {
      try {
        sleeper.sleepNanos(waitNanos);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IngestionInterruptedException(
            "Interrupted while waiting for a rate limit slot", e);
      }
    }
  }

  public long getIntervalNanos() {
    return intervalNanos;
  }
}
