/**
 * Lifecycle automation engine: turns stage entries, business events and clock ticks into
 * messages, stage transitions and drip-campaign deliveries, each performed at most once.
 *
 * <p>Start with {@link io.automation.AutomationEngine}. Events are modelled by
 * {@link io.automation.LifecycleEvent}; the evaluator turns them into
 * {@link io.automation.Candidate}s which only execute after their natural key is claimed in the
 * {@link io.automation.spi.ExecutionLedger}.
 */
package io.automation;
