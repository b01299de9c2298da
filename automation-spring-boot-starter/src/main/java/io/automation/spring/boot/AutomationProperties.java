package io.automation.spring.boot;

import io.automation.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the automation engine.
 *
 * @see AutomationAutoConfiguration
 */
@ConfigurationProperties(prefix = "automation")
public class AutomationProperties {

  /**
   * Whether to create the engine bean.
   */
  private boolean enabled = true;

  /**
   * Prefix of every table name.
   */
  private String tablePrefix = TableNames.DEFAULT_PREFIX;

  /**
   * IANA zone used for tenants without an entry in {@code tenantZones}.
   */
  private String defaultZone = "UTC";

  /**
   * Per-tenant IANA zones, keyed by tenant id.
   */
  private Map<String, String> tenantZones = new LinkedHashMap<>();

  private final Scheduler scheduler = new Scheduler();
  private final Dispatcher dispatcher = new Dispatcher();
  private final Retry retry = new Retry();
  private final Metrics metrics = new Metrics();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getTablePrefix() {
    return tablePrefix;
  }

  public void setTablePrefix(String tablePrefix) {
    this.tablePrefix = tablePrefix;
  }

  public String getDefaultZone() {
    return defaultZone;
  }

  public void setDefaultZone(String defaultZone) {
    this.defaultZone = defaultZone;
  }

  public Map<String, String> getTenantZones() {
    return tenantZones;
  }

  public void setTenantZones(Map<String, String> tenantZones) {
    this.tenantZones = tenantZones;
  }

  public Scheduler getScheduler() {
    return scheduler;
  }

  public Dispatcher getDispatcher() {
    return dispatcher;
  }

  public Retry getRetry() {
    return retry;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Scheduler {
    /**
     * Whether to start the tick loop with the application context.
     */
    private boolean enabled = true;
    private Duration interval = Duration.ofMinutes(1);
    /**
     * Width of the countdown window evaluated on each tick. Must be at least {@code interval}.
     */
    private Duration countdownLookback = Duration.ofMinutes(2);
    private int batchSize = 200;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public Duration getCountdownLookback() {
      return countdownLookback;
    }

    public void setCountdownLookback(Duration countdownLookback) {
      this.countdownLookback = countdownLookback;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }
  }

  public static class Dispatcher {
    /**
     * FAILED transitions before a record moves to DEAD.
     */
    private int attemptCeiling = 5;
    private Duration transportTimeout = Duration.ofSeconds(30);
    /**
     * Age after which a CLAIMED record is expired by reconciliation.
     */
    private Duration claimGracePeriod = Duration.ofMinutes(10);

    public int getAttemptCeiling() {
      return attemptCeiling;
    }

    public void setAttemptCeiling(int attemptCeiling) {
      this.attemptCeiling = attemptCeiling;
    }

    public Duration getTransportTimeout() {
      return transportTimeout;
    }

    public void setTransportTimeout(Duration transportTimeout) {
      this.transportTimeout = transportTimeout;
    }

    public Duration getClaimGracePeriod() {
      return claimGracePeriod;
    }

    public void setClaimGracePeriod(Duration claimGracePeriod) {
      this.claimGracePeriod = claimGracePeriod;
    }
  }

  public static class Retry {
    private Duration baseDelay = Duration.ofMinutes(1);
    private Duration maxDelay = Duration.ofHours(1);

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "automation";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
