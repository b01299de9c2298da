package io.automation.schedule;

import io.automation.spi.ClockSource;
import io.automation.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives clock ticks on a single daemon thread with a fixed delay between ticks.
 *
 * <p>A failing tick is logged and the schedule continues. Several schedulers may run
 * against the same ledger on different nodes; the ledger's claim keeps their side
 * effects exactly-once.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 */
public final class AutomationScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AutomationScheduler.class.getName());

  private final ClockSource clockSource;
  private final TickHandler handler;
  private final long intervalMs;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> tickTask;
  private volatile boolean closed;

  public AutomationScheduler(ClockSource clockSource, TickHandler handler, Duration interval) {
    this.clockSource = Objects.requireNonNull(clockSource, "clockSource");
    this.handler = Objects.requireNonNull(handler, "handler");
    Objects.requireNonNull(interval, "interval");
    if (interval.toMillis() <= 0L) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.intervalMs = interval.toMillis();
  }

  /**
   * Starts the tick loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("AutomationScheduler has been closed");
    }
    if (tickTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("automation-scheduler-"));
    tickTask = scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "Automation scheduler started, interval {0} ms", intervalMs);
  }

  /**
   * Executes a single tick. Called automatically by the scheduler, but may also be invoked directly for testing.
   */
  public void runOnce() {
    if (closed) {
      return;
    }
    try {
      handler.onTick(clockSource.now());
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Tick failed", t);
    }
  }

  public boolean isRunning() {
    return tickTask != null && !closed;
  }

  /**
   * Cancels the tick schedule and shuts down the scheduler thread.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
