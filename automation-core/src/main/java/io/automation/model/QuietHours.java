package io.automation.model;

import java.time.LocalTime;

/**
 * Local-time window {@code [startHour, endHour)} during which sends are deferred.
 * The window wraps midnight when {@code startHour > endHour} (for example 21 to 8).
 *
 * <p>An {@code endHour} of 24 means "until midnight" and is stored as 0, so 22 to 24
 * and 22 to 0 are the same window.
 */
public record QuietHours(int startHour, int endHour) {

  public QuietHours {
    if (startHour < 0 || startHour > 23) {
      throw new IllegalArgumentException("quiet hours start must be within 0..23");
    }
    if (endHour < 0 || endHour > 24) {
      throw new IllegalArgumentException("quiet hours end must be within 0..24");
    }
    if (startHour == 0 && endHour == 24) {
      throw new IllegalArgumentException("quiet hours window must not cover the whole day");
    }
    endHour = endHour % 24;
    if (startHour == endHour) {
      throw new IllegalArgumentException("quiet hours window must not be empty");
    }
  }

  public boolean wrapsMidnight() {
    return startHour > endHour;
  }

  public boolean contains(LocalTime localTime) {
    int hour = localTime.getHour();
    if (wrapsMidnight()) {
      return hour >= startHour || hour < endHour;
    }
    return hour >= startHour && hour < endHour;
  }
}
