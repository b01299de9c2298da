package io.automation.dispatch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code baseDelay * 2^(attempts-1)}, capped at {@code maxDelay}.
 *
 * <p>With jitter enabled (the default) the delay is scaled by a random factor in
 * [0.5, 1.5) and capped again, so workers retrying the same provider outage spread out.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay) {
    this(baseDelay, maxDelay, true);
  }

  /**
   * @param baseDelay delay before the first retry
   * @param maxDelay  upper bound for any delay
   * @param jitter    whether to randomize delays
   */
  public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay, boolean jitter) {
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (baseDelay.isNegative() || baseDelay.isZero()) {
      throw new IllegalArgumentException("baseDelay must be > 0, got: " + baseDelay);
    }
    if (maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
    }
    this.baseDelayMs = baseDelay.toMillis();
    this.maxDelayMs = maxDelay.toMillis();
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long delay = maxDelayMs;
    if (attempts < 63) {
      long factor = 1L << (attempts - 1);
      // factor * base would overflow or exceed the cap
      if (factor <= maxDelayMs / baseDelayMs) {
        delay = baseDelayMs * factor;
      }
    }
    if (!jitter) {
      return delay;
    }
    long jittered = (long) (delay * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    return Math.min(maxDelayMs, Math.max(0L, jittered));
  }
}
