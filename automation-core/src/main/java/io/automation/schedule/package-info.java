/**
 * Time-based scheduling: quiet-hour shifting and the periodic tick loop.
 *
 * @see io.automation.schedule.QuietHoursScheduler
 * @see io.automation.schedule.AutomationScheduler
 */
package io.automation.schedule;
