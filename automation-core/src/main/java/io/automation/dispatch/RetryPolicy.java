package io.automation.dispatch;

/**
 * Computes the delay before the next attempt of a FAILED record.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Returns the delay in milliseconds before the next attempt.
   *
   * @param attempts the number of failed attempts so far (1-based)
   * @return delay in milliseconds (must be non-negative)
   */
  long computeDelayMs(int attempts);
}
