package io.automation.schedule;

import io.automation.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AutomationSchedulerTest {
  private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

  @Test
  void runOncePassesClockTimeToHandler() {
    List<Instant> ticks = new CopyOnWriteArrayList<>();
    AutomationScheduler scheduler = new AutomationScheduler(clock, ticks::add, Duration.ofMinutes(1));

    scheduler.runOnce();
    clock.advance(Duration.ofMinutes(1));
    scheduler.runOnce();

    assertEquals(List.of(Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-01-01T00:01:00Z")), ticks);
  }

  @Test
  void failingTickDoesNotStopLaterTicks() {
    AtomicInteger calls = new AtomicInteger();
    AutomationScheduler scheduler = new AutomationScheduler(clock, now -> {
      if (calls.incrementAndGet() == 1) {
        throw new IllegalStateException("boom");
      }
    }, Duration.ofMinutes(1));

    assertDoesNotThrow(scheduler::runOnce);
    scheduler.runOnce();

    assertEquals(2, calls.get());
  }

  @Test
  void startRunsTicksUntilClosed() throws InterruptedException {
    CountDownLatch latch = new CountDownLatch(3);
    AutomationScheduler scheduler = new AutomationScheduler(clock, now -> latch.countDown(), Duration.ofMillis(10));
    try {
      scheduler.start();
      scheduler.start();
      assertTrue(scheduler.isRunning());
      assertTrue(latch.await(5, TimeUnit.SECONDS));
    } finally {
      scheduler.close();
    }
    assertFalse(scheduler.isRunning());
  }

  @Test
  void closedSchedulerRejectsStartAndIgnoresTicks() {
    AtomicInteger calls = new AtomicInteger();
    AutomationScheduler scheduler = new AutomationScheduler(clock, now -> calls.incrementAndGet(), Duration.ofMinutes(1));
    scheduler.close();

    assertThrows(IllegalStateException.class, scheduler::start);
    scheduler.runOnce();
    assertEquals(0, calls.get());
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class,
        () -> new AutomationScheduler(clock, now -> { }, Duration.ZERO));
  }
}
