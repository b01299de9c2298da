package io.automation.jdbc;

import java.util.Objects;

/**
 * Physical table names used by the JDBC ledger and stores, derived from one validated prefix.
 *
 * <p>The DDL scripts under {@code schema/} use the default prefix {@value #DEFAULT_PREFIX}.
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "automation_";
  private static final String NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private static final TableNames DEFAULTS = new TableNames(DEFAULT_PREFIX);

  private final String prefix;

  private TableNames(String prefix) {
    this.prefix = prefix;
  }

  public static TableNames defaults() {
    return DEFAULTS;
  }

  /**
   * @throws IllegalArgumentException if the prefix would not form a plain SQL identifier
   */
  public static TableNames withPrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    validate(prefix + "x");
    return new TableNames(prefix);
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  public String prefix() {
    return prefix;
  }

  public String execution() {
    return prefix + "execution";
  }

  public String delivery() {
    return prefix + "delivery";
  }

  public String messageLog() {
    return prefix + "message_log";
  }

  public String subscription() {
    return prefix + "subscription";
  }

  public String rule() {
    return prefix + "rule";
  }

  public String step() {
    return prefix + "step";
  }

  public String triggerBinding() {
    return prefix + "trigger_binding";
  }

  public String campaign() {
    return prefix + "campaign";
  }

  public String campaignItem() {
    return prefix + "campaign_item";
  }

  public String campaignHistory() {
    return prefix + "campaign_history";
  }
}
