/**
 * Spring Boot auto-configuration for the automation engine.
 *
 * <p>{@link io.automation.spring.boot.AutomationAutoConfiguration} builds the engine
 * from a {@code DataSource}; {@link io.automation.spring.boot.AutomationMicrometerAutoConfiguration}
 * contributes a Micrometer metrics exporter.
 */
package io.automation.spring.boot;
