package io.automation.jdbc.ledger;

import io.automation.jdbc.JdbcTemplate;
import io.automation.jdbc.TableNames;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL execution ledger.
 *
 * <p>Claims with {@code INSERT ... ON CONFLICT DO NOTHING}, so a lost race costs no
 * savepoint and never aborts the caller's transaction.
 */
public final class PostgresExecutionLedger extends AbstractJdbcExecutionLedger {

  public PostgresExecutionLedger() {
    super();
  }

  public PostgresExecutionLedger(TableNames tableNames) {
    super(tableNames);
  }

  @Override
  public AbstractJdbcExecutionLedger withTableNames(TableNames tableNames) {
    return new PostgresExecutionLedger(tableNames);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected boolean insertIfAbsent(Connection conn, String sql, Object... params) {
    return JdbcTemplate.update(conn, sql + " ON CONFLICT DO NOTHING", params) == 1;
  }
}
