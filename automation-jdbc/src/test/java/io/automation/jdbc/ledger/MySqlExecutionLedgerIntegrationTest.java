package io.automation.jdbc.ledger;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.automation.jdbc.DockerAvailable;
import io.automation.jdbc.support.TestDatabases;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class MySqlExecutionLedgerIntegrationTest extends AbstractExecutionLedgerIntegrationTest {

  @Container
  static final MySQLContainer<?> database = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("automation_test");

  private static final MySqlExecutionLedger LEDGER = new MySqlExecutionLedger();
  private static HikariDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(database.getJdbcUrl());
    config.setUsername(database.getUsername());
    config.setPassword(database.getPassword());
    config.setMaximumPoolSize(4);
    dataSource = new HikariDataSource(config);
    TestDatabases.createSchema(dataSource, "mysql");
  }

  @AfterAll
  static void closePool() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcExecutionLedger ledger() {
    return LEDGER;
  }

  @Override
  String jdbcUrl() {
    return database.getJdbcUrl();
  }
}
