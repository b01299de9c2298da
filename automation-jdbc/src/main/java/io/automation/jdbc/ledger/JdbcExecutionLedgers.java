package io.automation.jdbc.ledger;

import io.automation.jdbc.TableNames;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC execution ledgers with auto-detection support.
 *
 * <p>Ledgers are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.automation.jdbc.ledger.AbstractJdbcExecutionLedger}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcExecutionLedger ledger = JdbcExecutionLedgers.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table prefix
 * AbstractJdbcExecutionLedger ledger = JdbcExecutionLedgers.detect("jdbc:mysql://localhost/crm")
 *     .withTableNames(TableNames.withPrefix("crm_automation_"));
 *
 * // Get by name
 * AbstractJdbcExecutionLedger ledger = JdbcExecutionLedgers.get("postgresql");
 * }</pre>
 */
public final class JdbcExecutionLedgers {

  private static final List<AbstractJdbcExecutionLedger> LEDGERS;
  private static final Map<String, AbstractJdbcExecutionLedger> BY_NAME = new ConcurrentHashMap<>();

  static {
    LEDGERS = ServiceLoader.load(AbstractJdbcExecutionLedger.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcExecutionLedger ledger : LEDGERS) {
      BY_NAME.put(ledger.name().toLowerCase(), ledger);
    }
  }

  private JdbcExecutionLedgers() {
  }

  /**
   * Returns all registered ledgers.
   */
  public static List<AbstractJdbcExecutionLedger> all() {
    return LEDGERS;
  }

  /**
   * Gets a ledger by name.
   *
   * @param name ledger name (case-insensitive)
   * @return the ledger
   * @throws IllegalArgumentException if no ledger found
   */
  public static AbstractJdbcExecutionLedger get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcExecutionLedger ledger = BY_NAME.get(name.toLowerCase());
    if (ledger == null) {
      throw new IllegalArgumentException("Unknown execution ledger: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return ledger;
  }

  /**
   * Auto-detects the ledger from a DataSource.
   *
   * @throws IllegalStateException if detection fails or no matching ledger
   */
  public static AbstractJdbcExecutionLedger detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect execution ledger from DataSource", e);
    }
  }

  /**
   * Auto-detects the ledger from a DataSource and binds it to the given tables.
   */
  public static AbstractJdbcExecutionLedger detect(DataSource dataSource, TableNames tableNames) {
    Objects.requireNonNull(tableNames, "tableNames");
    return detect(dataSource).withTableNames(tableNames);
  }

  /**
   * Auto-detects the ledger from a JDBC URL.
   *
   * @throws IllegalArgumentException if no matching ledger found
   */
  public static AbstractJdbcExecutionLedger detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    for (AbstractJdbcExecutionLedger ledger : LEDGERS) {
      for (String prefix : ledger.jdbcUrlPrefixes()) {
        if (jdbcUrl.toLowerCase().startsWith(prefix.toLowerCase())) {
          return ledger;
        }
      }
    }

    throw new IllegalArgumentException("No execution ledger found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return LEDGERS.stream()
        .flatMap(l -> l.jdbcUrlPrefixes().stream())
        .toList();
  }
}
