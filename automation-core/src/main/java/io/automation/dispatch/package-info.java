/**
 * Side effects and record resolution.
 *
 * <p>{@link io.automation.dispatch.ActionDispatcher} performs a claimed action and resolves
 * its ledger record. {@link io.automation.dispatch.RetrySweep} re-claims due FAILED records and
 * {@link io.automation.dispatch.ReconciliationSweep} expires claims left behind by crashed
 * workers. Backoff is pluggable through {@link io.automation.dispatch.RetryPolicy}.
 */
package io.automation.dispatch;
