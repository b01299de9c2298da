package io.automation.dead;

import io.automation.model.LedgerRecord;
import io.automation.model.MessageLogEntry;
import io.automation.model.RecordRef;
import io.automation.model.RecordType;
import io.automation.spi.ConnectionProvider;
import io.automation.spi.ExecutionLedger;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade for inspecting DEAD records and per-subject history.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}. DEAD records
 * are terminal and cannot be replayed.
 *
 * @see ExecutionLedger#queryDead
 * @see ExecutionLedger#countDead
 */
public final class DeadRecordManager {
  private static final Logger logger = Logger.getLogger(DeadRecordManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ExecutionLedger ledger;

  public DeadRecordManager(ConnectionProvider connectionProvider, ExecutionLedger ledger) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
  }

  /**
   * Queries DEAD records of one type.
   *
   * @param type  execution or delivery records
   * @param limit maximum number of records to return
   * @return list of dead records, oldest first
   */
  public List<LedgerRecord> query(RecordType type, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return ledger.queryDead(conn, type, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query dead records", e);
      return List.of();
    }
  }

  /**
   * Counts DEAD records of one type.
   */
  public int count(RecordType type) {
    try (Connection conn = connectionProvider.getConnection()) {
      return ledger.countDead(conn, type);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count dead records", e);
      return 0;
    }
  }

  /**
   * Returns the execution and delivery records of one subject, newest first.
   */
  public List<LedgerRecord> history(String tenantId, String subjectId, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return ledger.history(conn, tenantId, subjectId, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to load history for subject " + subjectId, e);
      return List.of();
    }
  }

  /**
   * Returns the transport attempts logged for a record, oldest first.
   */
  public List<MessageLogEntry> messageLog(RecordRef ref) {
    try (Connection conn = connectionProvider.getConnection()) {
      return ledger.messageLog(conn, ref);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to load message log for record " + ref, e);
      return List.of();
    }
  }
}
