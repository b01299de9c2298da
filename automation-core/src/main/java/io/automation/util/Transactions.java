package io.automation.util;

import io.automation.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs work on a fresh connection, either in a single transaction or in auto-commit mode.
 */
public final class Transactions {

  private Transactions() {
  }

  @FunctionalInterface
  public interface SqlWork<T> {
    T execute(Connection conn) throws SQLException;
  }

  /**
   * Commits if {@code work} returns normally, rolls back and rethrows otherwise.
   */
  public static <T> T inTransaction(ConnectionProvider connectionProvider, SqlWork<T> work)
      throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.execute(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    }
  }

  public static <T> T autoCommit(ConnectionProvider connectionProvider, SqlWork<T> work)
      throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return work.execute(conn);
    }
  }
}
