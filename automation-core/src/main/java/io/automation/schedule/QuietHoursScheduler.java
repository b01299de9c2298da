package io.automation.schedule;

import io.automation.model.QuietHours;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Shifts a desired send time out of a quiet-hour window.
 *
 * <p>Times inside {@code [start, end)} (tenant-local wall clock) move forward to the next
 * local {@code end:00}; times outside are returned unchanged. The shift never moves
 * backward, and {@code shift(shift(t)) == shift(t)} holds for every window, including
 * windows whose end falls into a DST gap.
 */
public final class QuietHoursScheduler {

  // A DST gap can push the end instant into the window at most once per day boundary
  private static final int MAX_SHIFTS = 3;

  /**
   * Returns {@code t} if it is outside the window, otherwise the next permitted instant.
   *
   * @param t      desired instant
   * @param window quiet hours, or {@code null} for none
   * @param zone   tenant time zone
   */
  public Instant shift(Instant t, QuietHours window, ZoneId zone) {
    if (window == null) {
      return t;
    }
    ZonedDateTime local = t.atZone(zone);
    for (int i = 0; i < MAX_SHIFTS && window.contains(local.toLocalTime()); i++) {
      local = nextEnd(local, window, zone);
    }
    return local.toInstant();
  }

  /**
   * Returns the instant a candidate may execute: {@code shift(max(desired, now))}.
   * Work already past due is never scheduled before {@code now}.
   */
  public Instant schedule(Instant desired, Instant now, QuietHours window, ZoneId zone) {
    Instant earliest = desired.isBefore(now) ? now : desired;
    return shift(earliest, window, zone);
  }

  private static ZonedDateTime nextEnd(ZonedDateTime local, QuietHours window, ZoneId zone) {
    LocalTime end = LocalTime.of(window.endHour(), 0);
    ZonedDateTime candidate = ZonedDateTime.of(local.toLocalDate(), end, zone);
    if (!candidate.isAfter(local)) {
      candidate = ZonedDateTime.of(local.toLocalDate().plusDays(1), end, zone);
    }
    return candidate;
  }
}
