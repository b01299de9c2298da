/**
 * JDBC-based {@link io.automation.spi.ExecutionLedger} implementations.
 *
 * <p>{@link io.automation.jdbc.ledger.AbstractJdbcExecutionLedger} provides shared SQL and row
 * mapping; subclasses supply the duplicate-key strategy used by the claim: a savepoint-guarded
 * insert (H2, MySQL) or {@code ON CONFLICT DO NOTHING} (PostgreSQL).
 *
 * @see io.automation.jdbc.ledger.JdbcExecutionLedgers
 */
package io.automation.jdbc.ledger;
