package io.automation.support;

import io.automation.spi.ClockSource;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Clock source whose time is set by the test. Every tenant shares one zone.
 */
public final class MutableClock implements ClockSource {
  private final ZoneId zone;
  private volatile Instant now;

  public MutableClock(Instant now, ZoneId zone) {
    this.now = now;
    this.zone = zone;
  }

  @Override
  public Instant now() {
    return now;
  }

  @Override
  public ZoneId zoneOf(String tenantId) {
    return zone;
  }

  public void set(Instant now) {
    this.now = now;
  }

  public void advance(Duration duration) {
    this.now = now.plus(duration);
  }
}
