package io.automation.jdbc.ledger;

import io.automation.Candidate;
import io.automation.CandidateAction;
import io.automation.jdbc.JdbcTemplate;
import io.automation.jdbc.TableNames;
import io.automation.model.ActionType;
import io.automation.model.Channel;
import io.automation.model.ClaimResult;
import io.automation.model.DeliveryStatus;
import io.automation.model.ExecutionStatus;
import io.automation.model.LedgerRecord;
import io.automation.model.MessageLogEntry;
import io.automation.model.RecordRef;
import io.automation.model.RecordType;
import io.automation.spi.ExecutionLedger;
import io.automation.util.Ids;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC execution ledger with standard SQL implementations.
 *
 * <p>Execution records (one-off sends and stage moves) and delivery records (campaign sends)
 * live in separate tables with the same status columns. Both carry a unique
 * {@code natural_key}; the claim is an insert that loses cleanly on a duplicate key.
 * A delivery claim first locks the subscription row ({@code SELECT ... FOR UPDATE}) and checks
 * that the subscription is live and still expects the delivered sequence index.
 *
 * <p>Subclasses override {@link #insertIfAbsent} to provide a database-specific duplicate-key
 * strategy. Register custom implementations via
 * {@code META-INF/services/io.automation.jdbc.ledger.AbstractJdbcExecutionLedger}.
 *
 * @see JdbcExecutionLedgers
 */
public abstract class AbstractJdbcExecutionLedger implements ExecutionLedger {
  private static final Logger logger = Logger.getLogger(AbstractJdbcExecutionLedger.class.getName());
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String EXECUTION_COLUMNS = "id, tenant_id, subject_id, rule_id, natural_key, " +
      "action_type, channel, template_id, target_stage_id, " +
      "status, attempts, claimed_at, next_attempt_at, resolved_at, provider_id, last_error";

  private static final String DELIVERY_COLUMNS = "id, tenant_id, subject_id, rule_id, natural_key, " +
      "campaign_id, subscription_id, content_item_id, sequence_index, " +
      "status, attempts, claimed_at, next_attempt_at, resolved_at, provider_id, last_error";

  private static final String MESSAGE_LOG_COLUMNS = "id, tenant_id, subject_id, record_type, record_id, " +
      "channel, recipient, status, provider_id, error, created_at";

  private static final JdbcTemplate.RowMapper<LedgerRecord> EXECUTION_ROW_MAPPER =
      rs -> toRecord(rs, RecordType.EXECUTION, executionAction(rs));

  private static final JdbcTemplate.RowMapper<LedgerRecord> DELIVERY_ROW_MAPPER =
      rs -> toRecord(rs, RecordType.DELIVERY, new CandidateAction.SendCampaignMessage(
          rs.getString("campaign_id"),
          rs.getString("subscription_id"),
          rs.getString("content_item_id"),
          rs.getInt("sequence_index")));

  private static final JdbcTemplate.RowMapper<MessageLogEntry> MESSAGE_LOG_ROW_MAPPER = rs -> new MessageLogEntry(
      rs.getString("id"),
      rs.getString("tenant_id"),
      rs.getString("subject_id"),
      new RecordRef(RecordType.valueOf(rs.getString("record_type")), rs.getString("record_id")),
      Channel.valueOf(rs.getString("channel")),
      rs.getString("recipient"),
      DeliveryStatus.valueOf(rs.getString("status")),
      rs.getString("provider_id"),
      rs.getString("error"),
      JdbcTemplate.instant(rs, "created_at"));

  private final TableNames tableNames;

  protected AbstractJdbcExecutionLedger() {
    this(TableNames.defaults());
  }

  protected AbstractJdbcExecutionLedger(TableNames tableNames) {
    this.tableNames = Objects.requireNonNull(tableNames, "tableNames");
  }

  /**
   * Unique identifier for this ledger (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this ledger handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a ledger of the same dialect over differently named tables.
   */
  public abstract AbstractJdbcExecutionLedger withTableNames(TableNames tableNames);

  public TableNames tableNames() {
    return tableNames;
  }

  // ── Claim ──────────────────────────────────────────────────────────

  @Override
  public ClaimResult claim(Connection conn, Candidate candidate, Instant now) {
    if (candidate.action() instanceof CandidateAction.EnrollInCampaign) {
      throw new IllegalArgumentException("Enrollments are not claimed in the ledger: " + candidate.key());
    }
    Instant claimedAt = now.truncatedTo(ChronoUnit.MILLIS);
    if (candidate.action() instanceof CandidateAction.SendCampaignMessage send) {
      return claimDelivery(conn, candidate, send, claimedAt);
    }
    return claimExecution(conn, candidate, claimedAt);
  }

  private ClaimResult claimExecution(Connection conn, Candidate candidate, Instant now) {
    String id = Ids.newId();
    CandidateAction action = candidate.action();
    Channel channel = null;
    String templateId = null;
    String targetStageId = null;
    if (action instanceof CandidateAction.SendMessage send) {
      channel = send.channel();
      templateId = send.templateId();
    } else if (action instanceof CandidateAction.ChangeStage change) {
      targetStageId = change.targetStageId();
    }
    String sql = "INSERT INTO " + tableNames.execution() + " (" + EXECUTION_COLUMNS + ")" +
        " VALUES (?,?,?,?,?,?,?,?,?," + ExecutionStatus.CLAIMED.code() + ",0,?,NULL,NULL,NULL,NULL)";
    boolean inserted = insertIfAbsent(conn, sql,
        id, candidate.tenantId(), candidate.subjectId(), candidate.ruleId(), candidate.key().value(),
        action.type(), channel, templateId, targetStageId, JdbcTemplate.timestamp(now));
    return granted(inserted, RecordType.EXECUTION, id, candidate);
  }

  private ClaimResult claimDelivery(Connection conn, Candidate candidate,
      CandidateAction.SendCampaignMessage send, Instant now) {
    String lockSql = "SELECT next_index, completed_at, unsubscribed_at FROM " + tableNames.subscription() +
        " WHERE id=? FOR UPDATE";
    Optional<Integer> expectedIndex = JdbcTemplate.queryOne(conn, lockSql,
        rs -> rs.getTimestamp("completed_at") == null && rs.getTimestamp("unsubscribed_at") == null
            ? rs.getInt("next_index") : null,
        send.subscriptionId());
    if (expectedIndex.isEmpty() || expectedIndex.get() != send.sequenceIndex()) {
      logger.log(Level.FINE, "Delivery for subscription {0} at index {1} is stale",
          new Object[]{send.subscriptionId(), send.sequenceIndex()});
      return ClaimResult.alreadyClaimed();
    }
    String id = Ids.newId();
    String sql = "INSERT INTO " + tableNames.delivery() + " (" + DELIVERY_COLUMNS + ")" +
        " VALUES (?,?,?,?,?,?,?,?,?," + ExecutionStatus.CLAIMED.code() + ",0,?,NULL,NULL,NULL,NULL)";
    boolean inserted = insertIfAbsent(conn, sql,
        id, candidate.tenantId(), candidate.subjectId(), candidate.ruleId(), candidate.key().value(),
        send.campaignId(), send.subscriptionId(), send.contentItemId(), send.sequenceIndex(),
        JdbcTemplate.timestamp(now));
    return granted(inserted, RecordType.DELIVERY, id, candidate);
  }

  private static ClaimResult granted(boolean inserted, RecordType type, String id, Candidate candidate) {
    if (!inserted) {
      logger.log(Level.FINE, "Natural key {0} already claimed", candidate.key().value());
      return ClaimResult.alreadyClaimed();
    }
    return ClaimResult.granted(new RecordRef(type, id));
  }

  /**
   * Inserts a claim row, returning {@code false} when the natural key (or another unique
   * constraint) already holds a row. The default uses a savepoint-guarded insert.
   */
  protected boolean insertIfAbsent(Connection conn, String sql, Object... params) {
    return JdbcTemplate.insertIfAbsent(conn, sql, params);
  }

  // ── Resolve ────────────────────────────────────────────────────────

  @Override
  public int markSucceeded(Connection conn, RecordRef ref, String providerId, Instant resolvedAt) {
    String sql = "UPDATE " + table(ref.type()) +
        " SET status=" + ExecutionStatus.SUCCEEDED.code() + ", resolved_at=?, provider_id=?, next_attempt_at=NULL" +
        " WHERE id=? AND status=" + ExecutionStatus.CLAIMED.code();
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(resolvedAt), providerId, ref.id());
  }

  @Override
  public int markFailed(Connection conn, RecordRef ref, Instant nextAttemptAt, String error) {
    String sql = "UPDATE " + table(ref.type()) +
        " SET status=" + ExecutionStatus.FAILED.code() + ", attempts=attempts+1, next_attempt_at=?, last_error=?" +
        " WHERE id=? AND status=" + ExecutionStatus.CLAIMED.code();
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(nextAttemptAt), truncateError(error), ref.id());
  }

  @Override
  public int markDead(Connection conn, RecordRef ref, String error, Instant resolvedAt) {
    String sql = "UPDATE " + table(ref.type()) +
        " SET status=" + ExecutionStatus.DEAD.code() + ", last_error=?, resolved_at=?, next_attempt_at=NULL" +
        " WHERE id=? AND status=" + ExecutionStatus.FAILED.code();
    return JdbcTemplate.update(conn, sql, truncateError(error), JdbcTemplate.timestamp(resolvedAt), ref.id());
  }

  @Override
  public int reclaim(Connection conn, RecordRef ref, Instant now) {
    Instant claimedAt = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + table(ref.type()) +
        " SET status=" + ExecutionStatus.CLAIMED.code() + ", claimed_at=?, next_attempt_at=NULL" +
        " WHERE id=? AND status=" + ExecutionStatus.FAILED.code() + " AND next_attempt_at <= ?";
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(claimedAt), ref.id(),
        JdbcTemplate.timestamp(now));
  }

  // ── Queries ────────────────────────────────────────────────────────

  @Override
  public List<LedgerRecord> findRetryable(Connection conn, RecordType type, Instant now, int limit) {
    String sql = select(type) + " WHERE status=" + ExecutionStatus.FAILED.code() +
        " AND next_attempt_at <= ? ORDER BY next_attempt_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, mapper(type), JdbcTemplate.timestamp(now), limit);
  }

  @Override
  public List<LedgerRecord> findStaleClaims(Connection conn, RecordType type, Instant claimedBefore, int limit) {
    String sql = select(type) + " WHERE status=" + ExecutionStatus.CLAIMED.code() +
        " AND claimed_at < ? ORDER BY claimed_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, mapper(type), JdbcTemplate.timestamp(claimedBefore), limit);
  }

  @Override
  public Optional<LedgerRecord> find(Connection conn, RecordRef ref) {
    return JdbcTemplate.queryOne(conn, select(ref.type()) + " WHERE id=?", mapper(ref.type()), ref.id());
  }

  @Override
  public List<LedgerRecord> history(Connection conn, String tenantId, String subjectId, int limit) {
    List<LedgerRecord> records = new ArrayList<>();
    for (RecordType type : RecordType.values()) {
      String sql = select(type) + " WHERE tenant_id=? AND subject_id=? ORDER BY claimed_at DESC LIMIT ?";
      records.addAll(JdbcTemplate.query(conn, sql, mapper(type), tenantId, subjectId, limit));
    }
    records.sort(Comparator.comparing(LedgerRecord::claimedAt).reversed());
    return records.size() > limit ? List.copyOf(records.subList(0, limit)) : records;
  }

  @Override
  public List<LedgerRecord> queryDead(Connection conn, RecordType type, int limit) {
    String sql = select(type) + " WHERE status=" + ExecutionStatus.DEAD.code() + " ORDER BY resolved_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, mapper(type), limit);
  }

  @Override
  public int countDead(Connection conn, RecordType type) {
    String sql = "SELECT COUNT(*) AS dead_count FROM " + table(type) +
        " WHERE status=" + ExecutionStatus.DEAD.code();
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getInt("dead_count")).orElse(0);
  }

  // ── Message log ────────────────────────────────────────────────────

  @Override
  public void appendMessageLog(Connection conn, MessageLogEntry entry) {
    String sql = "INSERT INTO " + tableNames.messageLog() + " (" + MESSAGE_LOG_COLUMNS + ")" +
        " VALUES (?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        entry.id(), entry.tenantId(), entry.subjectId(), entry.record().type(), entry.record().id(),
        entry.channel(), entry.recipient(), entry.status(), entry.providerId(), truncateError(entry.error()),
        JdbcTemplate.timestamp(entry.createdAt()));
  }

  @Override
  public List<MessageLogEntry> messageLog(Connection conn, RecordRef ref) {
    String sql = "SELECT " + MESSAGE_LOG_COLUMNS + " FROM " + tableNames.messageLog() +
        " WHERE record_type=? AND record_id=? ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, MESSAGE_LOG_ROW_MAPPER, ref.type(), ref.id());
  }

  // ── Helpers ────────────────────────────────────────────────────────

  private String table(RecordType type) {
    return type == RecordType.DELIVERY ? tableNames.delivery() : tableNames.execution();
  }

  private String select(RecordType type) {
    String columns = type == RecordType.DELIVERY ? DELIVERY_COLUMNS : EXECUTION_COLUMNS;
    return "SELECT " + columns + " FROM " + table(type);
  }

  private static JdbcTemplate.RowMapper<LedgerRecord> mapper(RecordType type) {
    return type == RecordType.DELIVERY ? DELIVERY_ROW_MAPPER : EXECUTION_ROW_MAPPER;
  }

  private static CandidateAction executionAction(ResultSet rs) throws SQLException {
    ActionType type = ActionType.valueOf(rs.getString("action_type"));
    return switch (type) {
      case SEND_MESSAGE -> new CandidateAction.SendMessage(
          Channel.valueOf(rs.getString("channel")), rs.getString("template_id"));
      case CHANGE_STAGE -> new CandidateAction.ChangeStage(rs.getString("target_stage_id"));
      case ENROLL_IN_CAMPAIGN -> throw new SQLException("Enrollments are stored as subscriptions");
      case SEND_CAMPAIGN_MESSAGE -> throw new SQLException("Campaign sends are stored as delivery records");
    };
  }

  private static LedgerRecord toRecord(ResultSet rs, RecordType type, CandidateAction action) throws SQLException {
    return new LedgerRecord(
        new RecordRef(type, rs.getString("id")),
        rs.getString("tenant_id"),
        rs.getString("subject_id"),
        rs.getString("rule_id"),
        rs.getString("natural_key"),
        action,
        ExecutionStatus.fromCode(rs.getInt("status")),
        rs.getInt("attempts"),
        JdbcTemplate.instant(rs, "claimed_at"),
        JdbcTemplate.instant(rs, "next_attempt_at"),
        JdbcTemplate.instant(rs, "resolved_at"),
        rs.getString("provider_id"),
        rs.getString("last_error"));
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
