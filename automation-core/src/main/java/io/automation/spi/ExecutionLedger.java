package io.automation.spi;

import io.automation.Candidate;
import io.automation.model.ClaimResult;
import io.automation.model.LedgerRecord;
import io.automation.model.MessageLogEntry;
import io.automation.model.RecordRef;
import io.automation.model.RecordType;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The idempotency substrate: atomic claim and resolve over execution and delivery
 * records keyed by natural keys.
 *
 * <p>Status transitions: CLAIMED &rarr; SUCCEEDED, CLAIMED &rarr; FAILED,
 * FAILED &rarr; CLAIMED (retry re-claim), FAILED &rarr; DEAD. SUCCEEDED and DEAD are terminal.
 * Every update is guarded on the expected current status and returns the number of
 * rows changed (0 or 1), so a lost race is visible to the caller.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations live in the {@code automation-jdbc} module.
 *
 * @see io.automation.jdbc.ledger.AbstractJdbcExecutionLedger
 */
public interface ExecutionLedger {

  /**
   * Inserts a CLAIMED record for the candidate's natural key.
   *
   * <p>Campaign deliveries are additionally checked against the subscription's current
   * {@code nextIndex}; a stale index or a finished subscription yields
   * {@link ClaimResult.AlreadyClaimed}. Enrollment candidates are never claimed here; the
   * subscription store deduplicates them.
   *
   * @param conn      the JDBC connection
   * @param candidate the candidate to claim
   * @param now       claim time
   * @return {@link ClaimResult.Granted} if this caller inserted the record
   * @throws IllegalArgumentException if the candidate is an enrollment
   */
  ClaimResult claim(Connection conn, Candidate candidate, Instant now);

  /**
   * Marks a CLAIMED record as SUCCEEDED.
   *
   * @return the number of rows updated (0 if the record is no longer CLAIMED)
   */
  int markSucceeded(Connection conn, RecordRef ref, String providerId, Instant resolvedAt);

  /**
   * Marks a CLAIMED record as FAILED, increments its attempt counter and schedules
   * the next attempt.
   *
   * @return the number of rows updated (0 if the record is no longer CLAIMED)
   */
  int markFailed(Connection conn, RecordRef ref, Instant nextAttemptAt, String error);

  /**
   * Marks a FAILED record as DEAD. DEAD records are never retried.
   *
   * @return the number of rows updated (0 if the record is not FAILED)
   */
  int markDead(Connection conn, RecordRef ref, String error, Instant resolvedAt);

  /**
   * Re-claims a FAILED record whose next attempt is due, reusing its natural key.
   *
   * @return 1 if this caller won the re-claim, 0 otherwise
   */
  int reclaim(Connection conn, RecordRef ref, Instant now);

  /**
   * Returns FAILED records whose next attempt is due, oldest first.
   */
  List<LedgerRecord> findRetryable(Connection conn, RecordType type, Instant now, int limit);

  /**
   * Returns CLAIMED records claimed before {@code claimedBefore}, oldest first.
   */
  List<LedgerRecord> findStaleClaims(Connection conn, RecordType type, Instant claimedBefore, int limit);

  Optional<LedgerRecord> find(Connection conn, RecordRef ref);

  /**
   * Returns the execution and delivery records of one subject, newest first.
   */
  List<LedgerRecord> history(Connection conn, String tenantId, String subjectId, int limit);

  /**
   * Returns DEAD records of the given type, oldest first.
   */
  List<LedgerRecord> queryDead(Connection conn, RecordType type, int limit);

  int countDead(Connection conn, RecordType type);

  /**
   * Appends an audit row for one transport attempt.
   */
  void appendMessageLog(Connection conn, MessageLogEntry entry);

  /**
   * Returns message log rows for a ledger record, oldest first.
   */
  List<MessageLogEntry> messageLog(Connection conn, RecordRef ref);
}
