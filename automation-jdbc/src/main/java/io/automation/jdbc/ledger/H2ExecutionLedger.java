package io.automation.jdbc.ledger;

import io.automation.jdbc.TableNames;

import java.util.List;

/**
 * H2 execution ledger. Primarily for testing.
 *
 * <p>Uses the default savepoint-guarded insert from {@link AbstractJdbcExecutionLedger}.
 */
public final class H2ExecutionLedger extends AbstractJdbcExecutionLedger {

  public H2ExecutionLedger() {
    super();
  }

  public H2ExecutionLedger(TableNames tableNames) {
    super(tableNames);
  }

  @Override
  public AbstractJdbcExecutionLedger withTableNames(TableNames tableNames) {
    return new H2ExecutionLedger(tableNames);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
