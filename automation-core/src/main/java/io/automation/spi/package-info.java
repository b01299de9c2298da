/**
 * Service Provider Interfaces (SPI) for plugging the engine into its surroundings.
 *
 * <p>Storage contracts receive an explicit {@link java.sql.Connection} so the caller
 * controls transaction boundaries; a ledger resolution, a subscription advance and a
 * stage transition commit together. JDBC implementations live in {@code automation-jdbc}.
 *
 * @see io.automation.spi.ExecutionLedger
 * @see io.automation.spi.RuleStore
 * @see io.automation.spi.SubjectStore
 * @see io.automation.spi.MessageTransport
 */
package io.automation.spi;
