package io.automation.dispatch;

import io.automation.model.ExecutionStatus;
import io.automation.model.LedgerRecord;
import io.automation.model.RecordType;
import io.automation.spi.ConnectionProvider;
import io.automation.spi.ExecutionLedger;
import io.automation.spi.MetricsExporter;
import io.automation.util.Transactions;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Expires records stuck in CLAIMED longer than the grace period. Such a record belongs to
 * a worker that crashed between claim and resolution; it is counted as a failed attempt
 * and enters the normal retry path.
 */
public final class ReconciliationSweep {
  private static final Logger logger = Logger.getLogger(ReconciliationSweep.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ExecutionLedger ledger;
  private final ActionDispatcher dispatcher;
  private final Duration gracePeriod;
  private final int batchSize;
  private final MetricsExporter metrics;

  public ReconciliationSweep(ConnectionProvider connectionProvider, ExecutionLedger ledger,
      ActionDispatcher dispatcher, Duration gracePeriod, int batchSize, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod");
    if (gracePeriod.isNegative() || gracePeriod.isZero()) {
      throw new IllegalArgumentException("gracePeriod must be positive");
    }
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.batchSize = batchSize;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * @return the number of stale claims expired
   */
  public int run(Instant now) {
    Instant claimedBefore = now.minus(gracePeriod);
    int expired = 0;
    for (RecordType type : RecordType.values()) {
      List<LedgerRecord> stale;
      try {
        stale = Transactions.autoCommit(connectionProvider,
            conn -> ledger.findStaleClaims(conn, type, claimedBefore, batchSize));
      } catch (SQLException e) {
        logger.log(Level.SEVERE, "Failed to fetch stale " + type + " claims", e);
        continue;
      }
      for (LedgerRecord record : stale) {
        logger.log(Level.WARNING, "Expiring stale claim {0} claimed at {1}",
            new Object[] {record.ref(), record.claimedAt()});
        try {
          if (dispatcher.expireClaim(ClaimedAction.of(record)) != ExecutionStatus.CLAIMED) {
            metrics.incrementStaleClaimsExpired();
            expired++;
          }
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Failed to expire claim " + record.ref(), e);
        }
      }
    }
    return expired;
  }
}
