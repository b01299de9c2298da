package io.automation.spring.boot;

import io.automation.AutomationEngine;
import io.automation.campaign.CampaignVersioner;
import io.automation.clock.SystemClockSource;
import io.automation.dead.DeadRecordManager;
import io.automation.dispatch.ExponentialBackoffRetryPolicy;
import io.automation.dispatch.RetryPolicy;
import io.automation.jdbc.DataSourceConnectionProvider;
import io.automation.jdbc.TableNames;
import io.automation.jdbc.ledger.JdbcExecutionLedgers;
import io.automation.jdbc.store.JdbcCampaignStore;
import io.automation.jdbc.store.JdbcRuleStore;
import io.automation.jdbc.store.JdbcSubscriptionStore;
import io.automation.spi.CampaignStore;
import io.automation.spi.ClockSource;
import io.automation.spi.ConnectionProvider;
import io.automation.spi.ExecutionLedger;
import io.automation.spi.MessageRenderer;
import io.automation.spi.MessageTransport;
import io.automation.spi.MetricsExporter;
import io.automation.spi.RuleStore;
import io.automation.spi.SubjectStore;
import io.automation.spi.SubscriptionStore;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Auto-configuration for the automation engine.
 *
 * <p>Wires the JDBC ledger and stores from a {@link DataSource} and
 * {@link AutomationProperties}. The application supplies the {@link SubjectStore},
 * {@link MessageRenderer} and {@link MessageTransport}; the engine bean is only
 * created once all three are present. Any JDBC-backed bean can be replaced by
 * declaring a bean of its SPI type.
 *
 * @see AutomationProperties
 * @see AutomationMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(AutomationEngine.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "automation", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(AutomationProperties.class)
public class AutomationAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public TableNames automationTableNames(AutomationProperties props) {
    return TableNames.withPrefix(props.getTablePrefix());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ExecutionLedger.class)
  public ExecutionLedger executionLedger(DataSource dataSource, TableNames tableNames) {
    return JdbcExecutionLedgers.detect(dataSource, tableNames);
  }

  @Bean
  @ConditionalOnMissingBean(SubscriptionStore.class)
  public JdbcSubscriptionStore subscriptionStore(TableNames tableNames) {
    return new JdbcSubscriptionStore(tableNames);
  }

  @Bean
  @ConditionalOnMissingBean(CampaignStore.class)
  public JdbcCampaignStore campaignStore(TableNames tableNames) {
    return new JdbcCampaignStore(tableNames);
  }

  @Bean
  @ConditionalOnMissingBean(RuleStore.class)
  public JdbcRuleStore ruleStore(ConnectionProvider connectionProvider, TableNames tableNames) {
    return new JdbcRuleStore(connectionProvider, tableNames);
  }

  @Bean
  @ConditionalOnMissingBean(ClockSource.class)
  public SystemClockSource clockSource(AutomationProperties props) {
    Map<String, ZoneId> tenantZones = new LinkedHashMap<>();
    props.getTenantZones().forEach((tenantId, zone) -> tenantZones.put(tenantId, ZoneId.of(zone)));
    return new SystemClockSource(Clock.systemUTC(), ZoneId.of(props.getDefaultZone()), tenantZones);
  }

  @Bean
  @ConditionalOnMissingBean(RetryPolicy.class)
  public ExponentialBackoffRetryPolicy retryPolicy(AutomationProperties props) {
    return new ExponentialBackoffRetryPolicy(props.getRetry().getBaseDelay(), props.getRetry().getMaxDelay());
  }

  @Bean
  @ConditionalOnMissingBean
  public CampaignVersioner campaignVersioner(ConnectionProvider connectionProvider,
      CampaignStore campaignStore, ClockSource clockSource) {
    return new CampaignVersioner(connectionProvider, campaignStore, clockSource);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean({SubjectStore.class, MessageRenderer.class, MessageTransport.class})
  public AutomationEngine automationEngine(AutomationProperties props,
      ConnectionProvider connectionProvider,
      ExecutionLedger ledger,
      RuleStore ruleStore,
      SubjectStore subjectStore,
      SubscriptionStore subscriptionStore,
      MessageRenderer renderer,
      MessageTransport transport,
      ClockSource clockSource,
      RetryPolicy retryPolicy,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var builder = AutomationEngine.builder()
        .connectionProvider(connectionProvider)
        .ledger(ledger)
        .ruleStore(ruleStore)
        .subjectStore(subjectStore)
        .subscriptionStore(subscriptionStore)
        .renderer(renderer)
        .transport(transport)
        .clockSource(clockSource)
        .retryPolicy(retryPolicy)
        .attemptCeiling(props.getDispatcher().getAttemptCeiling())
        .transportTimeout(props.getDispatcher().getTransportTimeout())
        .claimGracePeriod(props.getDispatcher().getClaimGracePeriod())
        .batchSize(props.getScheduler().getBatchSize())
        .tickInterval(props.getScheduler().getInterval())
        .countdownLookback(props.getScheduler().getCountdownLookback());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    AutomationEngine engine = builder.build();
    if (props.getScheduler().isEnabled()) {
      engine.start();
    }
    return engine;
  }

  @Bean
  @ConditionalOnBean(AutomationEngine.class)
  @ConditionalOnMissingBean
  public DeadRecordManager deadRecordManager(AutomationEngine automationEngine) {
    return automationEngine.deadRecords();
  }
}
