package io.automation.jdbc.store;

import io.automation.jdbc.JdbcTemplate;
import io.automation.jdbc.TableNames;
import io.automation.model.Subscription;
import io.automation.spi.SubscriptionStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link SubscriptionStore}.
 *
 * <p>A unique constraint on {@code (subject_id, campaign_id)} enforces one subscription per
 * subject and campaign version; {@link #insert} reports a violation as {@code false}. Updates
 * are guarded on the subscription being live, and {@link #advance} additionally on the
 * expected sequence index.
 */
public final class JdbcSubscriptionStore implements SubscriptionStore {
  private static final String COLUMNS = "id, tenant_id, campaign_id, lineage_id, subject_id, " +
      "next_index, next_send_at, started_at, completed_at, unsubscribed_at";

  private static final String LIVE = " AND completed_at IS NULL AND unsubscribed_at IS NULL";

  private static final JdbcTemplate.RowMapper<Subscription> ROW_MAPPER = rs -> new Subscription(
      rs.getString("id"),
      rs.getString("tenant_id"),
      rs.getString("campaign_id"),
      rs.getString("lineage_id"),
      rs.getString("subject_id"),
      rs.getInt("next_index"),
      JdbcTemplate.instant(rs, "next_send_at"),
      JdbcTemplate.instant(rs, "started_at"),
      JdbcTemplate.instant(rs, "completed_at"),
      JdbcTemplate.instant(rs, "unsubscribed_at"));

  private final String table;

  public JdbcSubscriptionStore() {
    this(TableNames.defaults());
  }

  public JdbcSubscriptionStore(TableNames tableNames) {
    this.table = Objects.requireNonNull(tableNames, "tableNames").subscription();
  }

  @Override
  public boolean insert(Connection conn, Subscription subscription) {
    String sql = "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)";
    return JdbcTemplate.insertIfAbsent(conn, sql,
        subscription.id(), subscription.tenantId(), subscription.campaignId(), subscription.lineageId(),
        subscription.subjectId(), subscription.nextIndex(),
        JdbcTemplate.timestamp(subscription.nextSendAt()), JdbcTemplate.timestamp(subscription.startedAt()),
        JdbcTemplate.timestamp(subscription.completedAt()), JdbcTemplate.timestamp(subscription.unsubscribedAt()));
  }

  @Override
  public Optional<Subscription> find(Connection conn, String subscriptionId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM " + table + " WHERE id=?",
        ROW_MAPPER, subscriptionId);
  }

  @Override
  public List<Subscription> findDue(Connection conn, Instant now, String afterId, int limit) {
    if (afterId == null) {
      String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE next_send_at <= ?" + LIVE +
          " ORDER BY id LIMIT ?";
      return JdbcTemplate.query(conn, sql, ROW_MAPPER, JdbcTemplate.timestamp(now), limit);
    }
    String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE next_send_at <= ? AND id > ?" + LIVE +
        " ORDER BY id LIMIT ?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, JdbcTemplate.timestamp(now), afterId, limit);
  }

  @Override
  public List<Subscription> findBySubject(Connection conn, String tenantId, String subjectId) {
    String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE tenant_id=? AND subject_id=? ORDER BY started_at";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, tenantId, subjectId);
  }

  @Override
  public boolean existsUncompletedInLineage(Connection conn, String subjectId, String lineageId) {
    String sql = "SELECT COUNT(*) AS n FROM " + table +
        " WHERE subject_id=? AND lineage_id=? AND completed_at IS NULL";
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getInt("n"), subjectId, lineageId).orElse(0) > 0;
  }

  @Override
  public int advance(Connection conn, String subscriptionId, int expectedIndex, int newIndex, Instant nextSendAt) {
    String sql = "UPDATE " + table + " SET next_index=?, next_send_at=? WHERE id=? AND next_index=?" + LIVE;
    return JdbcTemplate.update(conn, sql, newIndex, JdbcTemplate.timestamp(nextSendAt), subscriptionId, expectedIndex);
  }

  @Override
  public int complete(Connection conn, String subscriptionId, Instant completedAt) {
    String sql = "UPDATE " + table + " SET completed_at=? WHERE id=?" + LIVE;
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(completedAt), subscriptionId);
  }

  @Override
  public int unsubscribe(Connection conn, String subscriptionId, Instant unsubscribedAt) {
    String sql = "UPDATE " + table + " SET unsubscribed_at=? WHERE id=?" + LIVE;
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(unsubscribedAt), subscriptionId);
  }
}
