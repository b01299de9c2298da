/**
 * Micrometer bridge for exporting automation engine metrics.
 *
 * <p>{@link io.automation.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.automation.spi.MetricsExporter} SPI with Micrometer counters, a timer and a gauge.
 */
package io.automation.micrometer;
