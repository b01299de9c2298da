package io.automation.spi;

/**
 * Observability hook for exporting engine counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of candidates produced by evaluation or campaign progression.
   */
  void incrementCandidatesEmitted();

  /**
   * Increments the count of candidates left unclaimed because their time has not come.
   */
  void incrementCandidatesDeferred();

  /**
   * Increments the count of claims won.
   */
  void incrementClaimGranted();

  /**
   * Increments the count of claims lost to an existing record.
   */
  void incrementClaimContended();

  /**
   * Increments the count of records resolved as SUCCEEDED.
   */
  void incrementDispatchSuccess();

  /**
   * Increments the count of records resolved as FAILED that will be retried.
   */
  void incrementDispatchFailure();

  /**
   * Increments the count of records moved to DEAD.
   */
  void incrementDispatchDead();

  /**
   * Increments the count of CLAIMED records expired by the reconciliation sweep.
   */
  default void incrementStaleClaimsExpired() {
  }

  default void incrementSubscriptionsEnrolled() {
  }

  default void incrementSubscriptionsCompleted() {
  }

  /**
   * Records the wall time of one scheduler tick.
   *
   * @param durationMs tick duration in milliseconds (always non-negative)
   */
  default void recordTickDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementCandidatesEmitted() {
    }

    @Override
    public void incrementCandidatesDeferred() {
    }

    @Override
    public void incrementClaimGranted() {
    }

    @Override
    public void incrementClaimContended() {
    }

    @Override
    public void incrementDispatchSuccess() {
    }

    @Override
    public void incrementDispatchFailure() {
    }

    @Override
    public void incrementDispatchDead() {
    }
  }
}
