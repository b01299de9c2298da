package io.automation.jdbc.store;

import io.automation.jdbc.JdbcTemplate;
import io.automation.jdbc.LedgerStoreException;
import io.automation.jdbc.TableNames;
import io.automation.model.AnchorDatePrecondition;
import io.automation.model.BusinessEventKind;
import io.automation.model.BusinessTriggerBinding;
import io.automation.model.Campaign;
import io.automation.model.CampaignContentItem;
import io.automation.model.Channel;
import io.automation.model.CountdownTiming;
import io.automation.model.QuietHours;
import io.automation.model.Rule;
import io.automation.model.RuleKind;
import io.automation.model.RuleSpec;
import io.automation.model.Step;
import io.automation.spi.ConnectionProvider;
import io.automation.spi.RuleStore;
import io.automation.util.Transactions;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link RuleStore}.
 *
 * <p>Reads run on their own auto-commit connection, so every call sees the latest committed
 * rule configuration. {@link #save} provisions a rule with its steps and trigger bindings
 * inside the caller's transaction.
 */
public final class JdbcRuleStore implements RuleStore {
  private static final String RULE_COLUMNS = "id, tenant_id, name, kind, enabled, effective_from, project_type, " +
      "stage_id, channel, template_id, anchor_precondition, offset_days, timing, trigger_time, stage_condition, " +
      "target_stage_id, lineage_id";

  private static final String STEP_COLUMNS = "id, rule_id, sequence_index, delay_seconds, template_id, " +
      "quiet_start_hour, quiet_end_hour, enabled";

  private static final String BINDING_COLUMNS = "rule_id, event_kind, min_amount_cents, subtype";

  private static final JdbcTemplate.RowMapper<Step> STEP_ROW_MAPPER = rs -> {
    Integer quietStart = JdbcTemplate.nullableInt(rs, "quiet_start_hour");
    Integer quietEnd = JdbcTemplate.nullableInt(rs, "quiet_end_hour");
    return new Step(
        rs.getString("id"),
        rs.getString("rule_id"),
        rs.getInt("sequence_index"),
        Duration.ofSeconds(rs.getLong("delay_seconds")),
        rs.getString("template_id"),
        quietStart == null || quietEnd == null ? null : new QuietHours(quietStart, quietEnd),
        rs.getBoolean("enabled"));
  };

  private static final JdbcTemplate.RowMapper<BusinessTriggerBinding> BINDING_ROW_MAPPER =
      rs -> new BusinessTriggerBinding(
          BusinessEventKind.valueOf(rs.getString("event_kind")),
          JdbcTemplate.nullableLong(rs, "min_amount_cents"),
          rs.getString("subtype"));

  private final ConnectionProvider connectionProvider;
  private final TableNames tableNames;
  private final JdbcCampaignStore campaignStore;

  public JdbcRuleStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.defaults());
  }

  public JdbcRuleStore(ConnectionProvider connectionProvider, TableNames tableNames) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableNames = Objects.requireNonNull(tableNames, "tableNames");
    this.campaignStore = new JdbcCampaignStore(tableNames);
  }

  @Override
  public List<Rule> rules(String tenantId, RuleKind kind) {
    return read(conn -> {
      String sql = "SELECT " + RULE_COLUMNS + " FROM " + tableNames.rule() + " WHERE tenant_id=? AND kind=? ORDER BY id";
      List<RuleRow> rows = JdbcTemplate.query(conn, sql, JdbcRuleStore::toRow, tenantId, kind);
      List<Rule> rules = new ArrayList<>(rows.size());
      for (RuleRow row : rows) {
        rules.add(row.toRule(specOf(conn, row)));
      }
      return rules;
    });
  }

  @Override
  public Optional<Campaign> campaign(String campaignId) {
    return read(conn -> campaignStore.find(conn, campaignId));
  }

  @Override
  public Optional<Campaign> currentCampaign(String tenantId, String lineageId) {
    return read(conn -> campaignStore.findCurrent(conn, tenantId, lineageId));
  }

  @Override
  public List<CampaignContentItem> contentItems(String campaignId) {
    return read(conn -> campaignStore.contentItems(conn, campaignId));
  }

  @Override
  public List<String> tenantIds() {
    return read(conn -> JdbcTemplate.query(conn,
        "SELECT tenant_id FROM " + tableNames.rule() +
            " UNION SELECT tenant_id FROM " + tableNames.campaign() + " ORDER BY tenant_id",
        rs -> rs.getString("tenant_id")));
  }

  /**
   * Inserts a rule together with its steps (COMMUNICATION) or trigger bindings (STAGE_CHANGE).
   */
  public void save(Connection conn, Rule rule) {
    RuleSpec spec = rule.spec();
    String stageId = null;
    Channel channel = null;
    String templateId = null;
    AnchorDatePrecondition anchorDate = null;
    Integer offsetDays = null;
    CountdownTiming timing = null;
    String triggerTime = null;
    String stageCondition = null;
    String targetStageId = null;
    String lineageId = null;
    if (spec instanceof RuleSpec.Communication communication) {
      stageId = communication.stageId();
      channel = communication.channel();
      anchorDate = communication.anchorDate();
    } else if (spec instanceof RuleSpec.StageChange stageChange) {
      targetStageId = stageChange.targetStageId();
    } else if (spec instanceof RuleSpec.Countdown countdown) {
      channel = countdown.channel();
      templateId = countdown.templateId();
      offsetDays = countdown.offsetDays();
      timing = countdown.timing();
      triggerTime = countdown.triggerTime().toString();
      stageCondition = countdown.stageCondition();
    } else if (spec instanceof RuleSpec.Nurture nurture) {
      lineageId = nurture.campaignLineageId();
    }
    JdbcTemplate.update(conn, "INSERT INTO " + tableNames.rule() + " (" + RULE_COLUMNS + ")" +
            " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
        rule.id(), rule.tenantId(), rule.name(), rule.kind(), rule.enabled(),
        JdbcTemplate.timestamp(rule.effectiveFrom()), rule.projectType(), stageId, channel, templateId,
        anchorDate, offsetDays, timing, triggerTime, stageCondition, targetStageId, lineageId);

    if (spec instanceof RuleSpec.Communication communication) {
      for (Step step : communication.steps()) {
        QuietHours quiet = step.quietHours();
        JdbcTemplate.update(conn, "INSERT INTO " + tableNames.step() + " (" + STEP_COLUMNS + ")" +
                " VALUES (?,?,?,?,?,?,?,?)",
            step.id(), rule.id(), step.sequenceIndex(), step.delayFromTrigger().toSeconds(), step.templateId(),
            quiet == null ? null : quiet.startHour(), quiet == null ? null : quiet.endHour(), step.enabled());
      }
    } else if (spec instanceof RuleSpec.StageChange stageChange) {
      for (BusinessTriggerBinding binding : stageChange.bindings()) {
        JdbcTemplate.update(conn, "INSERT INTO " + tableNames.triggerBinding() + " (" + BINDING_COLUMNS + ")" +
                " VALUES (?,?,?,?)",
            rule.id(), binding.kind(), binding.minAmountCents(), binding.subtype());
      }
    }
  }

  private RuleSpec specOf(Connection conn, RuleRow row) {
    return switch (row.kind()) {
      case COMMUNICATION -> new RuleSpec.Communication(row.stageId(), row.channel(), row.anchorDate(),
          JdbcTemplate.query(conn, "SELECT " + STEP_COLUMNS + " FROM " + tableNames.step() +
              " WHERE rule_id=? ORDER BY sequence_index", STEP_ROW_MAPPER, row.id()));
      case STAGE_CHANGE -> new RuleSpec.StageChange(row.targetStageId(),
          JdbcTemplate.query(conn, "SELECT " + BINDING_COLUMNS + " FROM " + tableNames.triggerBinding() +
              " WHERE rule_id=? ORDER BY event_kind", BINDING_ROW_MAPPER, row.id()));
      case COUNTDOWN -> new RuleSpec.Countdown(row.channel(), row.templateId(),
          row.offsetDays() == null ? 0 : row.offsetDays(), row.timing(),
          LocalTime.parse(row.triggerTime()), row.stageCondition());
      case NURTURE -> new RuleSpec.Nurture(row.lineageId());
    };
  }

  private <T> T read(Transactions.SqlWork<T> work) {
    try {
      return Transactions.autoCommit(connectionProvider, work);
    } catch (SQLException e) {
      throw new LedgerStoreException("Failed to read automation rules", e);
    }
  }

  private static RuleRow toRow(ResultSet rs) throws SQLException {
    String channel = rs.getString("channel");
    String anchorDate = rs.getString("anchor_precondition");
    String timing = rs.getString("timing");
    return new RuleRow(
        rs.getString("id"),
        rs.getString("tenant_id"),
        rs.getString("name"),
        RuleKind.valueOf(rs.getString("kind")),
        rs.getBoolean("enabled"),
        JdbcTemplate.instant(rs, "effective_from"),
        rs.getString("project_type"),
        rs.getString("stage_id"),
        channel == null ? null : Channel.valueOf(channel),
        rs.getString("template_id"),
        anchorDate == null ? null : AnchorDatePrecondition.valueOf(anchorDate),
        JdbcTemplate.nullableInt(rs, "offset_days"),
        timing == null ? null : CountdownTiming.valueOf(timing),
        rs.getString("trigger_time"),
        rs.getString("stage_condition"),
        rs.getString("target_stage_id"),
        rs.getString("lineage_id"));
  }

  private record RuleRow(
      String id,
      String tenantId,
      String name,
      RuleKind kind,
      boolean enabled,
      Instant effectiveFrom,
      String projectType,
      String stageId,
      Channel channel,
      String templateId,
      AnchorDatePrecondition anchorDate,
      Integer offsetDays,
      CountdownTiming timing,
      String triggerTime,
      String stageCondition,
      String targetStageId,
      String lineageId
  ) {
    Rule toRule(RuleSpec spec) {
      return new Rule(id, tenantId, name, enabled, effectiveFrom, projectType, spec);
    }
  }
}
