package io.automation.dispatch;

import io.automation.model.LedgerRecord;
import io.automation.model.RecordType;
import io.automation.spi.ConnectionProvider;
import io.automation.spi.ExecutionLedger;
import io.automation.util.Transactions;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Re-claims FAILED records whose next attempt is due and hands them back to the
 * dispatcher. The re-claim is a guarded FAILED &rarr; CLAIMED update, so concurrent
 * sweeps on several nodes retry each record at most once.
 */
public final class RetrySweep {
  private static final Logger logger = Logger.getLogger(RetrySweep.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ExecutionLedger ledger;
  private final ActionDispatcher dispatcher;
  private final int batchSize;

  public RetrySweep(ConnectionProvider connectionProvider, ExecutionLedger ledger,
      ActionDispatcher dispatcher, int batchSize) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.batchSize = batchSize;
  }

  /**
   * Retries up to {@code batchSize} due records of each type.
   *
   * @return the number of records re-claimed and dispatched
   */
  public int run(Instant now) {
    int retried = 0;
    for (RecordType type : RecordType.values()) {
      List<LedgerRecord> due;
      try {
        due = Transactions.autoCommit(connectionProvider,
            conn -> ledger.findRetryable(conn, type, now, batchSize));
      } catch (SQLException e) {
        logger.log(Level.SEVERE, "Failed to fetch retryable " + type + " records", e);
        continue;
      }
      for (LedgerRecord record : due) {
        try {
          if (reclaim(record, now)) {
            dispatcher.dispatch(ClaimedAction.of(record));
            retried++;
          }
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Retry failed for record " + record.ref(), e);
        }
      }
    }
    return retried;
  }

  private boolean reclaim(LedgerRecord record, Instant now) {
    try {
      return Transactions.autoCommit(connectionProvider,
          conn -> ledger.reclaim(conn, record.ref(), now)) == 1;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to re-claim record " + record.ref(), e);
      return false;
    }
  }
}
