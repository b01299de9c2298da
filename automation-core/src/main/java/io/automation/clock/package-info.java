/**
 * {@link io.automation.spi.ClockSource} implementations.
 */
package io.automation.clock;
