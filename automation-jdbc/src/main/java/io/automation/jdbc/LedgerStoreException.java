package io.automation.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC ledger and stores.
 */
public final class LedgerStoreException extends RuntimeException {
  public LedgerStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
