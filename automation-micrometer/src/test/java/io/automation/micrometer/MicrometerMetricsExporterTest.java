package io.automation.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void candidateCounters() {
    exporter.incrementCandidatesEmitted();
    exporter.incrementCandidatesEmitted();
    exporter.incrementCandidatesDeferred();

    assertEquals(2.0, counter("automation.candidates.emitted").count());
    assertEquals(1.0, counter("automation.candidates.deferred").count());
  }

  @Test
  void claimCounters() {
    exporter.incrementClaimGranted();
    exporter.incrementClaimContended();
    exporter.incrementClaimContended();
    exporter.incrementStaleClaimsExpired();

    assertEquals(1.0, counter("automation.claims.granted").count());
    assertEquals(2.0, counter("automation.claims.contended").count());
    assertEquals(1.0, counter("automation.claims.stale.expired").count());
  }

  @Test
  void dispatchCounters() {
    exporter.incrementDispatchSuccess();
    exporter.incrementDispatchFailure();
    exporter.incrementDispatchDead();

    assertEquals(1.0, counter("automation.dispatch.success").count());
    assertEquals(1.0, counter("automation.dispatch.failure").count());
    assertEquals(1.0, counter("automation.dispatch.dead").count());
  }

  @Test
  void subscriptionCounters() {
    exporter.incrementSubscriptionsEnrolled();
    exporter.incrementSubscriptionsCompleted();

    assertEquals(1.0, counter("automation.subscriptions.enrolled").count());
    assertEquals(1.0, counter("automation.subscriptions.completed").count());
  }

  @Test
  void tickDurationFeedsTimerAndGauge() {
    exporter.recordTickDurationMs(120);
    exporter.recordTickDurationMs(80);

    Timer timer = registry.find("automation.tick.duration").timer();
    assertNotNull(timer);
    assertEquals(2, timer.count());
    assertEquals(200.0, timer.totalTime(TimeUnit.MILLISECONDS));
    assertEquals(80.0, gauge("automation.tick.last.ms").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "studio.automation");
    custom.incrementClaimGranted();
    custom.recordTickDurationMs(15);

    assertEquals(1.0, counter("studio.automation.claims.granted").count());
    assertEquals(15.0, gauge("studio.automation.tick.last.ms").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementDispatchSuccess();
    exporter.close();
    exporter.incrementDispatchSuccess();

    assertNull(registry.find("automation.dispatch.success").counter());
    assertNull(registry.find("automation.tick.duration").timer());
    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void invalidArgumentsAreRejected() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "automation."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
