package io.automation.jdbc.store;

import io.automation.jdbc.JdbcTemplate;
import io.automation.jdbc.TableNames;
import io.automation.model.ApprovalStatus;
import io.automation.model.Cadence;
import io.automation.model.Campaign;
import io.automation.model.CampaignContentItem;
import io.automation.model.CampaignHistoryEntry;
import io.automation.model.CampaignStatus;
import io.automation.spi.CampaignStore;

import java.sql.Connection;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link CampaignStore}.
 *
 * <p>Campaign versions and their content items are immutable once inserted, apart from the
 * {@code current_version} flag cleared by {@link #retireVersion}. History is append-only.
 */
public final class JdbcCampaignStore implements CampaignStore {
  private static final String CAMPAIGN_COLUMNS = "id, tenant_id, lineage_id, name, target_stage_id, " +
      "project_type, status, cadence_interval, cadence_unit, max_duration_seconds, initial_delay_seconds, " +
      "version, parent_version_id, current_version";

  private static final String ITEM_COLUMNS = "id, campaign_id, sequence_index, subject, body, original_body, " +
      "approval_status, edited_by, edited_at";

  private static final String HISTORY_COLUMNS = "id, lineage_id, campaign_id, parent_campaign_id, version, " +
      "edited_by, reason, summary, changed_at";

  private static final JdbcTemplate.RowMapper<Campaign> CAMPAIGN_ROW_MAPPER = rs -> new Campaign(
      rs.getString("id"),
      rs.getString("tenant_id"),
      rs.getString("lineage_id"),
      rs.getString("name"),
      rs.getString("target_stage_id"),
      rs.getString("project_type"),
      CampaignStatus.valueOf(rs.getString("status")),
      new Cadence(rs.getInt("cadence_interval"), Cadence.Unit.valueOf(rs.getString("cadence_unit"))),
      Duration.ofSeconds(rs.getLong("max_duration_seconds")),
      Duration.ofSeconds(rs.getLong("initial_delay_seconds")),
      rs.getInt("version"),
      rs.getString("parent_version_id"),
      rs.getBoolean("current_version"));

  private static final JdbcTemplate.RowMapper<CampaignContentItem> ITEM_ROW_MAPPER = rs -> new CampaignContentItem(
      rs.getString("id"),
      rs.getString("campaign_id"),
      rs.getInt("sequence_index"),
      rs.getString("subject"),
      rs.getString("body"),
      rs.getString("original_body"),
      ApprovalStatus.valueOf(rs.getString("approval_status")),
      rs.getString("edited_by"),
      JdbcTemplate.instant(rs, "edited_at"));

  private static final JdbcTemplate.RowMapper<CampaignHistoryEntry> HISTORY_ROW_MAPPER = rs -> new CampaignHistoryEntry(
      rs.getString("id"),
      rs.getString("lineage_id"),
      rs.getString("campaign_id"),
      rs.getString("parent_campaign_id"),
      rs.getInt("version"),
      rs.getString("edited_by"),
      rs.getString("reason"),
      rs.getString("summary"),
      JdbcTemplate.instant(rs, "changed_at"));

  private final TableNames tableNames;

  public JdbcCampaignStore() {
    this(TableNames.defaults());
  }

  public JdbcCampaignStore(TableNames tableNames) {
    this.tableNames = Objects.requireNonNull(tableNames, "tableNames");
  }

  @Override
  public Optional<Campaign> find(Connection conn, String campaignId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + CAMPAIGN_COLUMNS + " FROM " + tableNames.campaign() +
        " WHERE id=?", CAMPAIGN_ROW_MAPPER, campaignId);
  }

  /**
   * Returns the version of a lineage currently flagged as current, if any.
   */
  public Optional<Campaign> findCurrent(Connection conn, String tenantId, String lineageId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + CAMPAIGN_COLUMNS + " FROM " + tableNames.campaign() +
        " WHERE tenant_id=? AND lineage_id=? AND current_version=?", CAMPAIGN_ROW_MAPPER, tenantId, lineageId, true);
  }

  @Override
  public List<CampaignContentItem> contentItems(Connection conn, String campaignId) {
    return JdbcTemplate.query(conn, "SELECT " + ITEM_COLUMNS + " FROM " + tableNames.campaignItem() +
        " WHERE campaign_id=? ORDER BY sequence_index", ITEM_ROW_MAPPER, campaignId);
  }

  @Override
  public void insertVersion(Connection conn, Campaign campaign, List<CampaignContentItem> items) {
    String sql = "INSERT INTO " + tableNames.campaign() + " (" + CAMPAIGN_COLUMNS + ")" +
        " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        campaign.id(), campaign.tenantId(), campaign.lineageId(), campaign.name(), campaign.targetStageId(),
        campaign.projectType(), campaign.status(), campaign.cadence().interval(), campaign.cadence().unit(),
        campaign.maxDuration().toSeconds(), campaign.initialDelay().toSeconds(),
        campaign.version(), campaign.parentVersionId(), campaign.currentVersion());
    String itemSql = "INSERT INTO " + tableNames.campaignItem() + " (" + ITEM_COLUMNS + ")" +
        " VALUES (?,?,?,?,?,?,?,?,?)";
    for (CampaignContentItem item : items) {
      JdbcTemplate.update(conn, itemSql,
          item.id(), campaign.id(), item.sequenceIndex(), item.subject(), item.body(), item.originalBody(),
          item.approvalStatus(), item.editedBy(), JdbcTemplate.timestamp(item.editedAt()));
    }
  }

  @Override
  public int retireVersion(Connection conn, String campaignId) {
    String sql = "UPDATE " + tableNames.campaign() + " SET current_version=? WHERE id=? AND current_version=?";
    return JdbcTemplate.update(conn, sql, false, campaignId, true);
  }

  /**
   * Changes the approval status of one content item in place, for the approval workflow.
   */
  public int updateApproval(Connection conn, String itemId, ApprovalStatus status) {
    String sql = "UPDATE " + tableNames.campaignItem() + " SET approval_status=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, status, itemId);
  }

  /**
   * Pauses or resumes a campaign version.
   */
  public int updateStatus(Connection conn, String campaignId, CampaignStatus status) {
    String sql = "UPDATE " + tableNames.campaign() + " SET status=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, status, campaignId);
  }

  @Override
  public void appendHistory(Connection conn, CampaignHistoryEntry entry) {
    String sql = "INSERT INTO " + tableNames.campaignHistory() + " (" + HISTORY_COLUMNS + ")" +
        " VALUES (?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        entry.id(), entry.lineageId(), entry.campaignId(), entry.parentCampaignId(), entry.version(),
        entry.editedBy(), entry.reason(), entry.summary(), JdbcTemplate.timestamp(entry.changedAt()));
  }

  @Override
  public List<CampaignHistoryEntry> history(Connection conn, String lineageId) {
    return JdbcTemplate.query(conn, "SELECT " + HISTORY_COLUMNS + " FROM " + tableNames.campaignHistory() +
        " WHERE lineage_id=? ORDER BY version", HISTORY_ROW_MAPPER, lineageId);
  }
}
