package io.automation.dispatch;

/**
 * How a failed send attempt is treated by the retry policy.
 */
public enum FailureClassification {
  /** Timeout, connection error, provider 5xx. Retried with backoff. */
  TRANSIENT,
  /** Provider throttling. Retried with backoff. */
  RATE_LIMITED,
  /** Invalid recipient, unsubscribed, rejected content. Moved to DEAD without retries. */
  PERMANENT;

  public boolean isRetryable() {
    return this != PERMANENT;
  }
}
