package io.automation.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper to reduce boilerplate in the ledger and store implementations.
 */
public final class JdbcTemplate {
  private static final String INTEGRITY_VIOLATION_CLASS = "23";

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute UPDATE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new LedgerStoreException("Failed to execute update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new LedgerStoreException("Failed to execute query", e);
    }
  }

  /** Execute SELECT expected to return at most one row; a {@code null} mapping reads as no row. */
  public static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  /**
   * Execute INSERT, returning {@code false} instead of throwing when a unique constraint rejects the row.
   *
   * <p>Inside a transaction the insert runs under a savepoint, so a rejected row leaves the
   * surrounding transaction usable on databases that abort it on error (PostgreSQL).
   */
  public static boolean insertIfAbsent(Connection conn, String sql, Object... params) {
    Savepoint savepoint = null;
    try {
      if (!conn.getAutoCommit()) {
        savepoint = conn.setSavepoint();
      }
      try (PreparedStatement ps = conn.prepareStatement(sql)) {
        bindParams(ps, params);
        ps.executeUpdate();
      }
      if (savepoint != null) {
        conn.releaseSavepoint(savepoint);
      }
      return true;
    } catch (SQLException e) {
      if (!isIntegrityViolation(e)) {
        throw new LedgerStoreException("Failed to execute insert", e);
      }
      rollbackTo(conn, savepoint, e);
      return false;
    }
  }

  public static boolean isIntegrityViolation(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      String state = current.getSQLState();
      if (state != null && state.startsWith(INTEGRITY_VIOLATION_CLASS)) {
        return true;
      }
    }
    return false;
  }

  public static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  /** Reads a nullable integer column. */
  public static Integer nullableInt(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value;
  }

  /** Reads a nullable long column. */
  public static Long nullableLong(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }

  private static void rollbackTo(Connection conn, Savepoint savepoint, SQLException cause) {
    if (savepoint == null) {
      return;
    }
    try {
      conn.rollback(savepoint);
    } catch (SQLException e) {
      e.addSuppressed(cause);
      throw new LedgerStoreException("Failed to roll back to savepoint", e);
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Boolean b) {
        ps.setBoolean(i + 1, b);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else if (param instanceof Enum<?> e) {
        ps.setString(i + 1, e.name());
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
