package io.automation.schedule;

import java.time.Instant;

/**
 * Callback run by the {@link AutomationScheduler} once per interval.
 *
 * @see io.automation.AutomationEngine#tick(Instant)
 */
@FunctionalInterface
public interface TickHandler {

  /**
   * Runs one tick.
   *
   * @param now the tick instant, read from the engine's clock source
   */
  void onTick(Instant now);
}
