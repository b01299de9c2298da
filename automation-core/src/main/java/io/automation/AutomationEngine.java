package io.automation;

import io.automation.campaign.CampaignProgressor;
import io.automation.clock.SystemClockSource;
import io.automation.dead.DeadRecordManager;
import io.automation.dispatch.ActionDispatcher;
import io.automation.dispatch.ClaimedAction;
import io.automation.dispatch.ReconciliationSweep;
import io.automation.dispatch.RetryPolicy;
import io.automation.dispatch.RetrySweep;
import io.automation.evaluate.TriggerEvaluator;
import io.automation.model.ClaimResult;
import io.automation.model.ExecutionStatus;
import io.automation.schedule.AutomationScheduler;
import io.automation.schedule.QuietHoursScheduler;
import io.automation.spi.ClockSource;
import io.automation.spi.ConnectionProvider;
import io.automation.spi.ExecutionLedger;
import io.automation.spi.MessageRenderer;
import io.automation.spi.MessageTransport;
import io.automation.spi.MetricsExporter;
import io.automation.spi.RuleStore;
import io.automation.spi.SubjectStore;
import io.automation.spi.SubscriptionStore;
import io.automation.util.Transactions;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the evaluator, campaign progressor, dispatcher and
 * sweeps into a single {@link AutoCloseable} unit.
 *
 * <p>Every candidate, whether it comes from an event or from a due subscription, follows
 * the same path: shift out of quiet hours, defer if not yet due, claim its natural key in
 * the ledger, and dispatch only if this caller won the claim. Enrollment candidates are
 * handed to the progressor instead of the ledger.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (AutomationEngine engine = AutomationEngine.builder()
 *     .connectionProvider(connProvider)
 *     .ledger(ledger)
 *     .ruleStore(rules)
 *     .subjectStore(subjects)
 *     .subscriptionStore(subscriptions)
 *     .renderer(renderer)
 *     .transport(transport)
 *     .build()) {
 *   engine.start();
 *   engine.handle(new LifecycleEvent.StageEntered(tenant, projectId, "signed", Instant.now()));
 * }
 * }</pre>
 *
 * @see TriggerEvaluator
 * @see CampaignProgressor
 * @see ActionDispatcher
 */
public final class AutomationEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AutomationEngine.class.getName());

  /**
   * What happened to one candidate.
   */
  public enum Outcome {
    /** Not yet due (delayed step or quiet hours); picked up again by a later tick. */
    DEFERRED,
    /** The natural key was already claimed. */
    CONTENDED,
    /** Claimed and dispatched; see the ledger for the resolved status. */
    DISPATCHED,
    ENROLLED,
    /** The campaign was not enrolling or the subject was already enrolled in the lineage. */
    NOT_ENROLLED,
    /** The claim could not be attempted (storage error). */
    ERROR
  }

  private final ConnectionProvider connectionProvider;
  private final ExecutionLedger ledger;
  private final RuleStore ruleStore;
  private final ClockSource clockSource;
  private final MetricsExporter metrics;
  private final TriggerEvaluator evaluator;
  private final QuietHoursScheduler quietHours;
  private final CampaignProgressor progressor;
  private final ActionDispatcher dispatcher;
  private final RetrySweep retrySweep;
  private final ReconciliationSweep reconciliationSweep;
  private final DeadRecordManager deadRecords;
  private final Duration tickInterval;
  private final Duration countdownLookback;

  private AutomationScheduler scheduler;
  private volatile boolean closed;

  private AutomationEngine(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
    this.ruleStore = Objects.requireNonNull(builder.ruleStore, "ruleStore");
    SubjectStore subjectStore = Objects.requireNonNull(builder.subjectStore, "subjectStore");
    SubscriptionStore subscriptionStore = Objects.requireNonNull(builder.subscriptionStore, "subscriptionStore");
    this.clockSource = builder.clockSource != null ? builder.clockSource : new SystemClockSource(ZoneOffset.UTC);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (builder.tickInterval == null || builder.tickInterval.toMillis() <= 0L) {
      throw new IllegalArgumentException("tickInterval must be > 0");
    }
    if (builder.countdownLookback == null || builder.countdownLookback.compareTo(builder.tickInterval) < 0) {
      throw new IllegalArgumentException("countdownLookback must be >= tickInterval");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.tickInterval = builder.tickInterval;
    this.countdownLookback = builder.countdownLookback;

    this.evaluator = new TriggerEvaluator(ruleStore, subjectStore, clockSource);
    this.quietHours = new QuietHoursScheduler();
    this.progressor = CampaignProgressor.builder()
        .connectionProvider(connectionProvider)
        .ruleStore(ruleStore)
        .subjectStore(subjectStore)
        .subscriptionStore(subscriptionStore)
        .clockSource(clockSource)
        .metrics(metrics)
        .batchSize(builder.batchSize)
        .build();
    this.dispatcher = ActionDispatcher.builder()
        .connectionProvider(connectionProvider)
        .ledger(ledger)
        .ruleStore(ruleStore)
        .subjectStore(subjectStore)
        .progressor(progressor)
        .renderer(builder.renderer)
        .transport(builder.transport)
        .clockSource(clockSource)
        .retryPolicy(builder.retryPolicy)
        .attemptCeiling(builder.attemptCeiling)
        .transportTimeout(builder.transportTimeout)
        .metrics(metrics)
        .stageTransitionListener((tenantId, subjectId, stageId, enteredAt) ->
            handle(new LifecycleEvent.StageEntered(tenantId, subjectId, stageId, enteredAt)))
        .build();
    this.retrySweep = new RetrySweep(connectionProvider, ledger, dispatcher, builder.batchSize);
    this.reconciliationSweep = new ReconciliationSweep(connectionProvider, ledger, dispatcher,
        builder.claimGracePeriod, builder.batchSize, metrics);
    this.deadRecords = new DeadRecordManager(connectionProvider, ledger);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Evaluates an event and processes every resulting candidate. A failure on one
   * candidate is logged and does not affect the others.
   *
   * @param event the lifecycle event
   * @return one outcome per candidate, in evaluation order
   */
  public List<Outcome> handle(LifecycleEvent event) {
    List<Candidate> candidates;
    try {
      candidates = evaluator.evaluate(event);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to evaluate " + event, e);
      return List.of();
    }
    return processAll(candidates, clockSource.now());
  }

  /**
   * Runs one tick at the clock source's current time.
   */
  public void tick() {
    tick(clockSource.now());
  }

  /**
   * Runs one tick: per-tenant clock-tick evaluation over {@code [now - lookback, now)},
   * due campaign deliveries, stale-claim reconciliation and retries.
   *
   * @param now the tick instant
   */
  public void tick(Instant now) {
    long startNanos = System.nanoTime();
    Instant windowStart = now.minus(countdownLookback);
    for (String tenantId : ruleStore.tenantIds()) {
      try {
        List<Candidate> candidates = evaluator.evaluate(new LifecycleEvent.ClockTick(tenantId, windowStart, now));
        processAll(candidates, now);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Tick evaluation failed for tenant " + tenantId, e);
      }
    }
    processAll(progressor.dueCandidates(now), now);
    reconciliationSweep.run(now);
    retrySweep.run(now);
    metrics.recordTickDurationMs(Math.max(0L, (System.nanoTime() - startNanos) / 1_000_000L));
  }

  /**
   * Processes one candidate: enroll, defer, or claim and dispatch.
   *
   * @param candidate the candidate
   * @param now       evaluation time
   * @return what happened to the candidate
   */
  public Outcome process(Candidate candidate, Instant now) {
    metrics.incrementCandidatesEmitted();
    if (candidate.action() instanceof CandidateAction.EnrollInCampaign) {
      return progressor.enroll(candidate, now).isPresent() ? Outcome.ENROLLED : Outcome.NOT_ENROLLED;
    }

    Instant executeAt = quietHours.schedule(candidate.desiredAt(), now, candidate.quietHours(),
        clockSource.zoneOf(candidate.tenantId()));
    if (executeAt.isAfter(now)) {
      metrics.incrementCandidatesDeferred();
      logger.log(Level.FINE, "Deferred {0} until {1}", new Object[] {candidate.key().value(), executeAt});
      return Outcome.DEFERRED;
    }

    ClaimResult claim;
    try {
      claim = Transactions.inTransaction(connectionProvider, conn -> ledger.claim(conn, candidate, now));
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to claim " + candidate.key().value(), e);
      return Outcome.ERROR;
    }
    if (!(claim instanceof ClaimResult.Granted granted)) {
      metrics.incrementClaimContended();
      logger.log(Level.FINE, "Already claimed: {0}", candidate.key().value());
      return Outcome.CONTENDED;
    }
    metrics.incrementClaimGranted();
    ExecutionStatus status = dispatcher.dispatch(ClaimedAction.granted(granted.ref(), candidate));
    logger.log(Level.FINE, "Dispatched {0} -> {1}", new Object[] {candidate.key().value(), status});
    return Outcome.DISPATCHED;
  }

  /**
   * Stops a subscription. Already-sent deliveries remain as history.
   *
   * @return {@code true} if the subscription was live
   */
  public boolean unsubscribe(String subscriptionId) {
    return progressor.unsubscribe(subscriptionId);
  }

  /**
   * Starts the periodic tick loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("AutomationEngine has been closed");
    }
    if (scheduler != null) {
      return;
    }
    scheduler = new AutomationScheduler(clockSource, this::tick, tickInterval);
    scheduler.start();
  }

  public TriggerEvaluator evaluator() {
    return evaluator;
  }

  public CampaignProgressor progressor() {
    return progressor;
  }

  public ActionDispatcher dispatcher() {
    return dispatcher;
  }

  public DeadRecordManager deadRecords() {
    return deadRecords;
  }

  private List<Outcome> processAll(List<Candidate> candidates, Instant now) {
    List<Outcome> outcomes = new ArrayList<>(candidates.size());
    for (Candidate candidate : candidates) {
      try {
        outcomes.add(process(candidate, now));
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to process " + candidate.key().value(), e);
        outcomes.add(Outcome.ERROR);
      }
    }
    return outcomes;
  }

  /**
   * Shuts down components in order: scheduler, dispatcher, metrics exporter.
   */
  @Override
  public synchronized void close() {
    closed = true;
    RuntimeException first = null;
    if (scheduler != null) {
      try {
        scheduler.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  // ── Builder ─────────────────────────────────────────────

  /**
   * Builder for {@link AutomationEngine}. A builder can be used once.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ExecutionLedger ledger;
    private RuleStore ruleStore;
    private SubjectStore subjectStore;
    private SubscriptionStore subscriptionStore;
    private MessageRenderer renderer;
    private MessageTransport transport;
    private ClockSource clockSource;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private int attemptCeiling = 5;
    private int batchSize = 200;
    private Duration transportTimeout = Duration.ofSeconds(30);
    private Duration claimGracePeriod = Duration.ofMinutes(10);
    private Duration tickInterval = Duration.ofMinutes(1);
    private Duration countdownLookback = Duration.ofMinutes(2);
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder ledger(ExecutionLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    /** <b>Required.</b> */
    public Builder ruleStore(RuleStore ruleStore) {
      this.ruleStore = ruleStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder subjectStore(SubjectStore subjectStore) {
      this.subjectStore = subjectStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder subscriptionStore(SubscriptionStore subscriptionStore) {
      this.subscriptionStore = subscriptionStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder renderer(MessageRenderer renderer) {
      this.renderer = renderer;
      return this;
    }

    /** <b>Required.</b> */
    public Builder transport(MessageTransport transport) {
      this.transport = transport;
      return this;
    }

    /** Optional. Defaults to the system clock with every tenant in UTC. */
    public Builder clockSource(ClockSource clockSource) {
      this.clockSource = clockSource;
      return this;
    }

    /** Optional. Defaults to exponential backoff from 1 minute up to 1 hour. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@code 5}. */
    public Builder attemptCeiling(int attemptCeiling) {
      this.attemptCeiling = attemptCeiling;
      return this;
    }

    /** Page size for due subscriptions, retryable records and stale claims. Optional. Defaults to {@code 200}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Optional. Defaults to 30 seconds. */
    public Builder transportTimeout(Duration transportTimeout) {
      this.transportTimeout = transportTimeout;
      return this;
    }

    /** Age after which a CLAIMED record counts as abandoned. Optional. Defaults to 10 minutes. */
    public Builder claimGracePeriod(Duration claimGracePeriod) {
      this.claimGracePeriod = claimGracePeriod;
      return this;
    }

    /** Delay between ticks once {@link #start()} is called. Optional. Defaults to 1 minute. */
    public Builder tickInterval(Duration tickInterval) {
      this.tickInterval = tickInterval;
      return this;
    }

    /**
     * Width of the countdown window evaluated on each tick. Must be at least the tick
     * interval so no trigger instant falls between two windows. Optional. Defaults to 2 minutes.
     */
    public Builder countdownLookback(Duration countdownLookback) {
      this.countdownLookback = countdownLookback;
      return this;
    }

    /**
     * @throws IllegalStateException if build() was already called
     */
    public AutomationEngine build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new AutomationEngine(this);
    }
  }
}
