package io.automation.spring.boot;

import io.automation.AutomationEngine;
import io.automation.LifecycleEvent;
import io.automation.campaign.CampaignVersioner;
import io.automation.dead.DeadRecordManager;
import io.automation.jdbc.DataSourceConnectionProvider;
import io.automation.jdbc.TableNames;
import io.automation.jdbc.ledger.AbstractJdbcExecutionLedger;
import io.automation.jdbc.ledger.H2ExecutionLedger;
import io.automation.jdbc.store.JdbcRuleStore;
import io.automation.jdbc.store.JdbcSubscriptionStore;
import io.automation.model.RecordType;
import io.automation.rules.InMemoryRuleStore;
import io.automation.spi.CampaignStore;
import io.automation.spi.ClockSource;
import io.automation.spi.ConnectionProvider;
import io.automation.spi.ExecutionLedger;
import io.automation.spi.RuleStore;
import io.automation.spi.SubscriptionStore;
import io.automation.support.Fixtures;
import io.automation.support.InMemorySubjectStore;
import io.automation.support.RecordingTransport;
import io.automation.support.StubRenderer;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AutomationAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          AutomationAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.mode=always",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql",
          "automation.scheduler.enabled=false");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(CollaboratorConfig.class).run(ctx -> {
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(H2ExecutionLedger.class, ctx.getBean(ExecutionLedger.class));
      assertInstanceOf(JdbcSubscriptionStore.class, ctx.getBean(SubscriptionStore.class));
      assertInstanceOf(JdbcRuleStore.class, ctx.getBean(RuleStore.class));
      assertNotNull(ctx.getBean(CampaignStore.class));
      assertNotNull(ctx.getBean(CampaignVersioner.class));
      assertNotNull(ctx.getBean(AutomationEngine.class));
      assertSame(ctx.getBean(AutomationEngine.class).deadRecords(), ctx.getBean(DeadRecordManager.class));
    });
  }

  @Test
  void engineRequiresApplicationCollaborators() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("executionLedger"));
      assertFalse(ctx.containsBean("automationEngine"));
      assertFalse(ctx.containsBean("deadRecordManager"));
    });
  }

  @Test
  void disabledByProperty() {
    runner.withPropertyValues("automation.enabled=false")
        .withUserConfiguration(CollaboratorConfig.class).run(ctx -> {
          assertFalse(ctx.containsBean("automationEngine"));
          assertFalse(ctx.containsBean("executionLedger"));
        });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(AutomationAutoConfiguration.class))
        .withUserConfiguration(CollaboratorConfig.class)
        .run(ctx -> assertFalse(ctx.containsBean("automationEngine")));
  }

  @Test
  void tablePrefixReachesLedger() {
    runner.withPropertyValues("automation.table-prefix=crm_")
        .withUserConfiguration(CollaboratorConfig.class).run(ctx -> {
          assertEquals("crm_execution", ctx.getBean(TableNames.class).execution());
          var ledger = (AbstractJdbcExecutionLedger) ctx.getBean(ExecutionLedger.class);
          assertEquals("crm_delivery", ledger.tableNames().delivery());
        });
  }

  @Test
  void tenantZonesBindToClockSource() {
    runner.withPropertyValues(
            "automation.default-zone=Europe/London",
            "automation.tenant-zones.studio-9=America/New_York")
        .withUserConfiguration(CollaboratorConfig.class).run(ctx -> {
          ClockSource clock = ctx.getBean(ClockSource.class);
          assertEquals(ZoneId.of("America/New_York"), clock.zoneOf("studio-9"));
          assertEquals(ZoneId.of("Europe/London"), clock.zoneOf("studio-1"));
        });
  }

  @Test
  void lookbackShorterThanIntervalFailsStartup() {
    runner.withPropertyValues(
            "automation.scheduler.interval=PT5M",
            "automation.scheduler.countdown-lookback=PT1M")
        .withUserConfiguration(CollaboratorConfig.class).run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void userRuleStoreReplacesJdbcStores() {
    runner.withUserConfiguration(CollaboratorConfig.class, InMemoryRulesConfig.class).run(ctx -> {
      assertInstanceOf(InMemoryRuleStore.class, ctx.getBean(RuleStore.class));
      assertInstanceOf(InMemoryRuleStore.class, ctx.getBean(CampaignStore.class));
      assertFalse(ctx.containsBean("ruleStore"));
    });
  }

  @Test
  void engineDispatchesAgainstInitializedSchema() {
    runner.withUserConfiguration(CollaboratorConfig.class).run(ctx -> {
      var rules = ctx.getBean(JdbcRuleStore.class);
      try (Connection conn = ctx.getBean(DataSource.class).getConnection()) {
        rules.save(conn, Fixtures.communication("r1", "booked", Fixtures.step("s1", "r1", Duration.ZERO, null)));
      }
      Instant now = Instant.now();
      ctx.getBean(InMemorySubjectStore.class).put(Fixtures.subject("p1", "booked", now));

      var outcomes = ctx.getBean(AutomationEngine.class)
          .handle(new LifecycleEvent.StageEntered(Fixtures.TENANT, "p1", "booked", now));

      assertEquals(List.of(AutomationEngine.Outcome.DISPATCHED), outcomes);
      assertEquals(1, ctx.getBean(RecordingTransport.class).sent().size());
      assertEquals(0, ctx.getBean(DeadRecordManager.class).count(RecordType.EXECUTION));
    });
  }

  @Test
  void startedSchedulerStopsWithContext() {
    runner.withPropertyValues("automation.scheduler.enabled=true", "automation.scheduler.interval=PT1H",
            "automation.scheduler.countdown-lookback=PT1H")
        .withUserConfiguration(CollaboratorConfig.class).run(ctx -> {
          AutomationEngine engine = ctx.getBean(AutomationEngine.class);
          assertDoesNotThrow(engine::start);
        });
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  // ── Test configurations ──────────────────────────────────────

  @Configuration
  static class CollaboratorConfig {
    @Bean
    InMemorySubjectStore subjectStore() {
      return new InMemorySubjectStore();
    }

    @Bean
    StubRenderer renderer() {
      return new StubRenderer();
    }

    @Bean
    RecordingTransport transport() {
      return RecordingTransport.accepting();
    }
  }

  @Configuration
  static class InMemoryRulesConfig {
    @Bean
    InMemoryRuleStore inMemoryRuleStore() {
      return new InMemoryRuleStore();
    }
  }
}
