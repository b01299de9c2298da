package io.automation.jdbc.ledger;

import io.automation.jdbc.TableNames;

import java.util.List;

/**
 * MySQL execution ledger (also TiDB and MariaDB).
 *
 * <p>InnoDB keeps the transaction open after a duplicate-key error, so the default
 * savepoint-guarded insert is used as is.
 */
public final class MySqlExecutionLedger extends AbstractJdbcExecutionLedger {

  public MySqlExecutionLedger() {
    super();
  }

  public MySqlExecutionLedger(TableNames tableNames) {
    super(tableNames);
  }

  @Override
  public AbstractJdbcExecutionLedger withTableNames(TableNames tableNames) {
    return new MySqlExecutionLedger(tableNames);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }
}
