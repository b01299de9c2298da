package io.automation.micrometer;

import io.automation.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code automation.candidates.emitted}: candidates produced by evaluation or progression</li>
 *   <li>{@code automation.candidates.deferred}: candidates not yet due</li>
 *   <li>{@code automation.claims.granted}: claims won</li>
 *   <li>{@code automation.claims.contended}: claims lost to an existing record</li>
 *   <li>{@code automation.claims.stale.expired}: CLAIMED records expired by reconciliation</li>
 *   <li>{@code automation.dispatch.success}: records resolved SUCCEEDED</li>
 *   <li>{@code automation.dispatch.failure}: records resolved FAILED (will retry)</li>
 *   <li>{@code automation.dispatch.dead}: records moved to DEAD</li>
 *   <li>{@code automation.subscriptions.enrolled}: campaign subscriptions created</li>
 *   <li>{@code automation.subscriptions.completed}: subscriptions that delivered their last item</li>
 * </ul>
 *
 * <h3>Timer and gauge</h3>
 * <ul>
 *   <li>{@code automation.tick.duration}: wall time of each scheduler tick</li>
 *   <li>{@code automation.tick.last.ms}: duration of the most recent tick in milliseconds</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter candidatesEmitted;
  private final Counter candidatesDeferred;
  private final Counter claimGranted;
  private final Counter claimContended;
  private final Counter staleClaimsExpired;
  private final Counter dispatchSuccess;
  private final Counter dispatchFailure;
  private final Counter dispatchDead;
  private final Counter subscriptionsEnrolled;
  private final Counter subscriptionsCompleted;
  private final Timer tickDuration;
  private final Gauge lastTickGauge;

  private final AtomicLong lastTickMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "automation"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "automation");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "studio.automation"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.candidatesEmitted = counter(namePrefix + ".candidates.emitted", "Candidates produced");
    this.candidatesDeferred = counter(namePrefix + ".candidates.deferred", "Candidates not yet due");
    this.claimGranted = counter(namePrefix + ".claims.granted", "Claims won");
    this.claimContended = counter(namePrefix + ".claims.contended", "Claims lost to an existing record");
    this.staleClaimsExpired = counter(namePrefix + ".claims.stale.expired", "Stale claims expired");
    this.dispatchSuccess = counter(namePrefix + ".dispatch.success", "Records resolved SUCCEEDED");
    this.dispatchFailure = counter(namePrefix + ".dispatch.failure", "Records failed (will retry)");
    this.dispatchDead = counter(namePrefix + ".dispatch.dead", "Records moved to DEAD");
    this.subscriptionsEnrolled = counter(namePrefix + ".subscriptions.enrolled", "Subscriptions created");
    this.subscriptionsCompleted = counter(namePrefix + ".subscriptions.completed", "Subscriptions completed");

    this.tickDuration = Timer.builder(namePrefix + ".tick.duration")
        .description("Scheduler tick wall time")
        .register(registry);
    this.lastTickGauge = Gauge.builder(namePrefix + ".tick.last.ms", lastTickMs, AtomicLong::get)
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementCandidatesEmitted() {
    if (closed) return;
    candidatesEmitted.increment();
  }

  @Override
  public void incrementCandidatesDeferred() {
    if (closed) return;
    candidatesDeferred.increment();
  }

  @Override
  public void incrementClaimGranted() {
    if (closed) return;
    claimGranted.increment();
  }

  @Override
  public void incrementClaimContended() {
    if (closed) return;
    claimContended.increment();
  }

  @Override
  public void incrementStaleClaimsExpired() {
    if (closed) return;
    staleClaimsExpired.increment();
  }

  @Override
  public void incrementDispatchSuccess() {
    if (closed) return;
    dispatchSuccess.increment();
  }

  @Override
  public void incrementDispatchFailure() {
    if (closed) return;
    dispatchFailure.increment();
  }

  @Override
  public void incrementDispatchDead() {
    if (closed) return;
    dispatchDead.increment();
  }

  @Override
  public void incrementSubscriptionsEnrolled() {
    if (closed) return;
    subscriptionsEnrolled.increment();
  }

  @Override
  public void incrementSubscriptionsCompleted() {
    if (closed) return;
    subscriptionsCompleted.increment();
  }

  @Override
  public void recordTickDurationMs(long durationMs) {
    if (closed) return;
    tickDuration.record(Duration.ofMillis(durationMs));
    lastTickMs.set(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the engine is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(candidatesEmitted, candidatesDeferred, claimGranted, claimContended,
        staleClaimsExpired, dispatchSuccess, dispatchFailure, dispatchDead,
        subscriptionsEnrolled, subscriptionsCompleted, tickDuration, lastTickGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
