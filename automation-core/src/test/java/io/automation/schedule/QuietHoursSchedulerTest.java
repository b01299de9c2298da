package io.automation.schedule;

import io.automation.model.QuietHours;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuietHoursSchedulerTest {
  private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");
  private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

  private final QuietHoursScheduler scheduler = new QuietHoursScheduler();

  @Test
  void timeOutsideWindowIsUnchanged() {
    Instant t = local("2025-05-10T10:15", BERLIN);

    assertEquals(t, scheduler.shift(t, new QuietHours(21, 8), BERLIN));
  }

  @Test
  void noWindowIsNoOp() {
    Instant t = local("2025-05-10T03:00", BERLIN);

    assertSame(t, scheduler.shift(t, null, BERLIN));
  }

  @Test
  void sameDayWindowShiftsToEnd() {
    Instant t = local("2025-05-10T13:15", BERLIN);

    assertEquals(local("2025-05-10T14:00", BERLIN), scheduler.shift(t, new QuietHours(12, 14), BERLIN));
  }

  @Test
  void lateEveningInWrappingWindowShiftsToNextMorning() {
    Instant t = local("2025-05-10T23:30", BERLIN);

    assertEquals(local("2025-05-11T08:00", BERLIN), scheduler.shift(t, new QuietHours(21, 8), BERLIN));
  }

  @Test
  void windowEndingAtTwentyFourShiftsToNextMidnight() {
    Instant t = local("2025-05-10T23:30", BERLIN);

    assertEquals(local("2025-05-11T00:00", BERLIN), scheduler.shift(t, new QuietHours(22, 24), BERLIN));
  }

  @Test
  void earlyMorningInWrappingWindowShiftsToSameMorning() {
    Instant t = local("2025-05-11T03:00", BERLIN);

    assertEquals(local("2025-05-11T08:00", BERLIN), scheduler.shift(t, new QuietHours(21, 8), BERLIN));
  }

  @Test
  void windowStartIsInsideAndWindowEndIsOutside() {
    QuietHours window = new QuietHours(21, 8);

    assertEquals(local("2025-05-11T08:00", BERLIN), scheduler.shift(local("2025-05-10T21:00", BERLIN), window, BERLIN));
    assertEquals(local("2025-05-11T08:00", BERLIN), scheduler.shift(local("2025-05-11T08:00", BERLIN), window, BERLIN));
  }

  @Test
  void shiftIsIdempotentAndNeverBackward() {
    List<QuietHours> windows = List.of(new QuietHours(21, 8), new QuietHours(12, 14),
        new QuietHours(0, 6), new QuietHours(23, 0), new QuietHours(1, 3));
    Instant start = local("2025-03-29T00:00", BERLIN);
    for (QuietHours window : windows) {
      for (int minutes = 0; minutes < 3 * 24 * 60; minutes += 17) {
        Instant t = start.plus(Duration.ofMinutes(minutes));
        Instant once = scheduler.shift(t, window, BERLIN);
        assertEquals(once, scheduler.shift(once, window, BERLIN), "not idempotent for " + window + " at " + t);
        assertFalse(once.isBefore(t), "shifted backward for " + window + " at " + t);
        assertFalse(window.contains(once.atZone(BERLIN).toLocalTime()), "still quiet for " + window + " at " + t);
      }
    }
  }

  @Test
  void windowEndingInsideDstGapResolvesForward() {
    // 2025-03-09 02:00 does not exist in New York
    QuietHours window = new QuietHours(22, 2);
    Instant t = local("2025-03-08T23:30", NEW_YORK);

    Instant shifted = scheduler.shift(t, window, NEW_YORK);

    assertEquals(ZonedDateTime.of(LocalDateTime.parse("2025-03-09T03:00"), NEW_YORK).toInstant(), shifted);
    assertEquals(shifted, scheduler.shift(shifted, window, NEW_YORK));
  }

  @Test
  void fallBackTransitionUsesWallClockEnd() {
    // 2025-10-26 Berlin falls back 03:00 -> 02:00
    QuietHours window = new QuietHours(22, 7);
    Instant t = local("2025-10-25T23:00", BERLIN);

    Instant shifted = scheduler.shift(t, window, BERLIN);

    assertEquals(7, shifted.atZone(BERLIN).getHour());
    assertEquals(Duration.ofHours(9), Duration.between(t, shifted));
  }

  @Test
  void scheduleNeverReturnsBeforeNow() {
    Instant now = local("2025-05-10T10:00", BERLIN);
    Instant desired = now.minus(Duration.ofDays(2));

    assertEquals(now, scheduler.schedule(desired, now, new QuietHours(21, 8), BERLIN));
  }

  @Test
  void schedulePastDueInsideQuietHoursShiftsFromNow() {
    Instant now = local("2025-05-10T22:00", BERLIN);
    Instant desired = local("2025-05-10T18:00", BERLIN);

    Instant scheduled = scheduler.schedule(desired, now, new QuietHours(21, 8), BERLIN);

    assertEquals(local("2025-05-11T08:00", BERLIN), scheduled);
    assertTrue(scheduled.isAfter(now));
  }

  private static Instant local(String dateTime, ZoneId zone) {
    return ZonedDateTime.of(LocalDateTime.parse(dateTime), zone).toInstant();
  }
}
