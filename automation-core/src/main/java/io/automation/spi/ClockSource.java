package io.automation.spi;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Current time and per-tenant time zone.
 */
public interface ClockSource {

  Instant now();

  /**
   * Returns the time zone quiet hours, countdown trigger times and cadence
   * arithmetic are evaluated in for the given tenant.
   */
  ZoneId zoneOf(String tenantId);
}
