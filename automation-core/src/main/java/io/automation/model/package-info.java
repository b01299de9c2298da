/**
 * Domain model for the automation engine.
 *
 * <p>Rules are a tagged variant ({@link io.automation.model.Rule} plus a kind-specific
 * {@link io.automation.model.RuleSpec}). Ledger rows are keyed by a
 * {@link io.automation.model.NaturalKey}; exactly one row may exist per key.
 *
 * @see io.automation.model.Rule
 * @see io.automation.model.LedgerRecord
 * @see io.automation.model.Subscription
 */
package io.automation.model;
