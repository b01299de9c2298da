/**
 * JDBC persistence for the automation engine.
 *
 * <p>{@link io.automation.jdbc.ledger.AbstractJdbcExecutionLedger} implements the execution
 * ledger with database-specific claim strategies, discovered by
 * {@link io.automation.jdbc.ledger.JdbcExecutionLedgers}. The {@code store} package holds the
 * subscription, rule and campaign stores. DDL scripts ship under {@code schema/}.
 *
 * @see io.automation.jdbc.JdbcTemplate
 * @see io.automation.jdbc.TableNames
 */
package io.automation.jdbc;
