package io.automation.clock;

import io.automation.spi.ClockSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ClockSource} backed by a {@link Clock}, with per-tenant zone overrides and a
 * fallback zone for tenants without one.
 */
public final class SystemClockSource implements ClockSource {
  private final Clock clock;
  private final ZoneId defaultZone;
  private final Map<String, ZoneId> tenantZones;

  public SystemClockSource(ZoneId defaultZone) {
    this(Clock.systemUTC(), defaultZone, Map.of());
  }

  public SystemClockSource(Clock clock, ZoneId defaultZone, Map<String, ZoneId> tenantZones) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone");
    this.tenantZones = Map.copyOf(Objects.requireNonNull(tenantZones, "tenantZones"));
  }

  @Override
  public Instant now() {
    return clock.instant();
  }

  @Override
  public ZoneId zoneOf(String tenantId) {
    return tenantZones.getOrDefault(tenantId, defaultZone);
  }
}
