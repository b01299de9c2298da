package io.automation.model;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Fixed interval between successive campaign sends.
 *
 * <p>Applied in the tenant's time zone using wall-clock arithmetic, so a weekly
 * cadence keeps its local send time across DST transitions.
 */
public record Cadence(int interval, Unit unit) {

  public enum Unit {
    DAYS,
    WEEKS
  }

  public Cadence {
    Objects.requireNonNull(unit, "unit");
    if (interval <= 0) {
      throw new IllegalArgumentException("interval must be > 0");
    }
  }

  public static Cadence days(int interval) {
    return new Cadence(interval, Unit.DAYS);
  }

  public static Cadence weeks(int interval) {
    return new Cadence(interval, Unit.WEEKS);
  }

  public Instant next(Instant from, ZoneId zone) {
    ZonedDateTime local = from.atZone(zone);
    ZonedDateTime next = unit == Unit.WEEKS ? local.plusWeeks(interval) : local.plusDays(interval);
    return next.toInstant();
  }
}
