package io.automation.dispatch;

import io.automation.CandidateAction;
import io.automation.campaign.CampaignProgressor;
import io.automation.model.CampaignContentItem;
import io.automation.model.Channel;
import io.automation.model.DeliveryStatus;
import io.automation.model.ExecutionStatus;
import io.automation.model.MessageLogEntry;
import io.automation.model.Subject;
import io.automation.spi.ClockSource;
import io.automation.spi.ConnectionProvider;
import io.automation.spi.ExecutionLedger;
import io.automation.spi.MessageRenderer;
import io.automation.spi.MessageTransport;
import io.automation.spi.MetricsExporter;
import io.automation.spi.RuleStore;
import io.automation.spi.SubjectStore;
import io.automation.util.DaemonThreadFactory;
import io.automation.util.Ids;
import io.automation.util.Transactions;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Performs the side effect of a claimed record and resolves the record.
 *
 * <p>The dispatcher is the only component that calls the {@link MessageTransport}. Each
 * call runs on a transport thread and is bounded by {@code transportTimeout}; a timeout
 * or exception counts as a transient failure. Resolution runs in one transaction with its
 * consequences:
 * <ul>
 *   <li>success: {@code SUCCEEDED}, message log row, subscription advance (campaign sends)
 *       or stage transition (stage changes);</li>
 *   <li>failure: {@code FAILED} with an incremented attempt counter and a backoff-scheduled
 *       next attempt, then {@code DEAD} if the failure is permanent or the attempt ceiling
 *       is reached. A permanent campaign failure unsubscribes the subscription; a campaign
 *       item that exhausts its retries is skipped.</li>
 * </ul>
 *
 * <p>A campaign delivery whose subscription is no longer live goes {@code DEAD} before
 * rendering, so a retried delivery never reaches the transport after an unsubscribe.
 *
 * <p>If the resolving transaction itself fails, the record stays CLAIMED and the
 * reconciliation sweep expires it later.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} to stop its transport threads.
 */
public final class ActionDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ActionDispatcher.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ExecutionLedger ledger;
  private final RuleStore ruleStore;
  private final SubjectStore subjectStore;
  private final CampaignProgressor progressor;
  private final MessageRenderer renderer;
  private final MessageTransport transport;
  private final ClockSource clockSource;
  private final RetryPolicy retryPolicy;
  private final int attemptCeiling;
  private final long transportTimeoutMs;
  private final MetricsExporter metrics;
  private final StageTransitionListener stageTransitionListener;
  private final ExecutorService transportExecutor;

  private ActionDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
    this.ruleStore = Objects.requireNonNull(builder.ruleStore, "ruleStore");
    this.subjectStore = Objects.requireNonNull(builder.subjectStore, "subjectStore");
    this.progressor = Objects.requireNonNull(builder.progressor, "progressor");
    this.renderer = Objects.requireNonNull(builder.renderer, "renderer");
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.clockSource = Objects.requireNonNull(builder.clockSource, "clockSource");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy
        : new ExponentialBackoffRetryPolicy(Duration.ofMinutes(1), Duration.ofHours(1));
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.stageTransitionListener = builder.stageTransitionListener != null
        ? builder.stageTransitionListener : StageTransitionListener.NONE;

    if (builder.attemptCeiling < 1) {
      throw new IllegalArgumentException("attemptCeiling must be >= 1");
    }
    if (builder.transportTimeout == null || builder.transportTimeout.isNegative()
        || builder.transportTimeout.isZero()) {
      throw new IllegalArgumentException("transportTimeout must be positive");
    }
    this.attemptCeiling = builder.attemptCeiling;
    this.transportTimeoutMs = builder.transportTimeout.toMillis();
    this.transportExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("automation-transport-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  public int attemptCeiling() {
    return attemptCeiling;
  }

  public Duration transportTimeout() {
    return Duration.ofMillis(transportTimeoutMs);
  }

  /**
   * Executes a claimed action and resolves its record.
   *
   * @param claimed a record currently CLAIMED by this worker
   * @return the status the record was resolved to, or {@link ExecutionStatus#CLAIMED} if
   *     the resolution could not be persisted
   */
  public ExecutionStatus dispatch(ClaimedAction claimed) {
    Objects.requireNonNull(claimed, "claimed");
    CandidateAction action = claimed.action();
    try {
      if (action instanceof CandidateAction.ChangeStage changeStage) {
        return changeStage(claimed, changeStage);
      }
      if (action instanceof CandidateAction.SendMessage || action instanceof CandidateAction.SendCampaignMessage) {
        return send(claimed);
      }
      throw new IllegalArgumentException("Action is not dispatchable: " + action.type());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Dispatch failed for record " + claimed.ref(), e);
      FailureClassification classification = e instanceof IllegalArgumentException
          ? FailureClassification.PERMANENT : FailureClassification.TRANSIENT;
      return resolveFailure(claimed, classification, describe(e), null);
    }
  }

  /**
   * Records a failed attempt for a claim whose outcome is unknown (the worker holding it
   * crashed or stalled past the grace period).
   */
  public ExecutionStatus expireClaim(ClaimedAction claimed) {
    return resolveFailure(claimed, FailureClassification.TRANSIENT, "claim expired before resolution", null);
  }

  private ExecutionStatus send(ClaimedAction claimed) {
    if (claimed.action() instanceof CandidateAction.SendCampaignMessage campaignMessage) {
      boolean live;
      try {
        live = progressor.isLive(campaignMessage.subscriptionId());
      } catch (SQLException | RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to read subscription for record " + claimed.ref(), e);
        return resolveFailure(claimed, FailureClassification.TRANSIENT, describe(e), null);
      }
      if (!live) {
        logger.log(Level.WARNING, "Subscription {0} is no longer live; dropping record {1}",
            new Object[] {campaignMessage.subscriptionId(), claimed.ref()});
        return resolveFailure(claimed, FailureClassification.PERMANENT, "subscription no longer live", null);
      }
    }
    RenderedMessage message;
    try {
      message = render(claimed);
    } catch (RenderException e) {
      logger.log(Level.WARNING, "Render failed for record {0}: {1}",
          new Object[] {claimed.ref(), e.getMessage()});
      return resolveFailure(claimed, FailureClassification.PERMANENT, e.getMessage(), null);
    }

    SendResult result = callTransport(message);
    if (result instanceof SendResult.Sent sent) {
      return resolveSuccess(claimed, message, sent.providerId());
    }
    SendResult.Failed failed = (SendResult.Failed) result;
    return resolveFailure(claimed, failed.classification(), failed.reason(), message);
  }

  private RenderedMessage render(ClaimedAction claimed) throws RenderException {
    Subject subject = subjectStore.find(claimed.tenantId(), claimed.subjectId())
        .orElseThrow(() -> new RenderException("Subject " + claimed.subjectId() + " not found"));
    if (claimed.action() instanceof CandidateAction.SendMessage sendMessage) {
      if (!subject.isReachable(sendMessage.channel())) {
        throw new RenderException("Subject " + subject.id() + " is not reachable by " + sendMessage.channel());
      }
      return renderer.render(subject, sendMessage.channel(), sendMessage.templateId());
    }
    CandidateAction.SendCampaignMessage campaignMessage = (CandidateAction.SendCampaignMessage) claimed.action();
    if (!subject.isReachable(Channel.EMAIL)) {
      throw new RenderException("Subject " + subject.id() + " is not reachable by " + Channel.EMAIL);
    }
    Optional<CampaignContentItem> item = ruleStore.contentItems(campaignMessage.campaignId()).stream()
        .filter(i -> i.id().equals(campaignMessage.contentItemId()))
        .findFirst();
    if (item.isEmpty()) {
      throw new RenderException("Content item " + campaignMessage.contentItemId() + " not found");
    }
    return renderer.renderCampaignItem(subject, item.get());
  }

  private SendResult callTransport(RenderedMessage message) {
    Future<SendResult> future = transportExecutor.submit(() -> transport.send(message));
    try {
      SendResult result = future.get(transportTimeoutMs, TimeUnit.MILLISECONDS);
      return result != null ? result : SendResult.failed(FailureClassification.TRANSIENT, "transport returned no result");
    } catch (TimeoutException e) {
      future.cancel(true);
      return SendResult.failed(FailureClassification.TRANSIENT,
          "transport timed out after " + transportTimeoutMs + " ms");
    } catch (ExecutionException e) {
      return SendResult.failed(FailureClassification.TRANSIENT, describe(e.getCause()));
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return SendResult.failed(FailureClassification.TRANSIENT, "interrupted while sending");
    }
  }

  private ExecutionStatus resolveSuccess(ClaimedAction claimed, RenderedMessage message, String providerId) {
    Instant now = clockSource.now();
    try {
      boolean resolved = Transactions.inTransaction(connectionProvider, conn -> {
        boolean won = ledger.markSucceeded(conn, claimed.ref(), providerId, now) == 1;
        if (won && claimed.action() instanceof CandidateAction.SendCampaignMessage campaignMessage) {
          progressor.advance(conn, campaignMessage.subscriptionId(), campaignMessage.sequenceIndex(), now);
        }
        ledger.appendMessageLog(conn, logEntry(claimed, message, DeliveryStatus.SENT, providerId, null, now));
        return won;
      });
      if (!resolved) {
        logger.log(Level.WARNING, "Record {0} was sent but is no longer CLAIMED; resolution lost",
            claimed.ref());
        return ExecutionStatus.CLAIMED;
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to mark SUCCEEDED for record " + claimed.ref(), e);
      return ExecutionStatus.CLAIMED;
    }
    metrics.incrementDispatchSuccess();
    return ExecutionStatus.SUCCEEDED;
  }

  private ExecutionStatus changeStage(ClaimedAction claimed, CandidateAction.ChangeStage changeStage) {
    Instant now = clockSource.now();
    boolean resolved;
    try {
      resolved = Transactions.inTransaction(connectionProvider, conn -> {
        subjectStore.applyStageTransition(conn, claimed.tenantId(), claimed.subjectId(),
            changeStage.targetStageId(), now);
        if (ledger.markSucceeded(conn, claimed.ref(), null, now) != 1) {
          conn.rollback();
          return false;
        }
        return true;
      });
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to apply stage transition for record " + claimed.ref(), e);
      return resolveFailure(claimed, FailureClassification.TRANSIENT, describe(e), null);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Stage transition rejected for record " + claimed.ref(), e);
      return resolveFailure(claimed, FailureClassification.TRANSIENT, describe(e), null);
    }
    if (!resolved) {
      logger.log(Level.WARNING, "Record {0} is no longer CLAIMED; stage change skipped", claimed.ref());
      return ExecutionStatus.CLAIMED;
    }
    metrics.incrementDispatchSuccess();
    logger.log(Level.INFO, "Moved subject {0} to stage {1} (rule {2})",
        new Object[] {claimed.subjectId(), changeStage.targetStageId(), claimed.ruleId()});
    try {
      stageTransitionListener.onStageEntered(claimed.tenantId(), claimed.subjectId(),
          changeStage.targetStageId(), now);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Stage transition listener failed for subject " + claimed.subjectId(), e);
    }
    return ExecutionStatus.SUCCEEDED;
  }

  private ExecutionStatus resolveFailure(ClaimedAction claimed, FailureClassification classification,
      String reason, RenderedMessage message) {
    Instant now = clockSource.now();
    int attempts = claimed.attempts() + 1;
    boolean dead = !classification.isRetryable() || attempts >= attemptCeiling;
    Instant nextAttemptAt = now.plusMillis(retryPolicy.computeDelayMs(attempts));
    String error = classification + ": " + reason;
    try {
      boolean resolved = Transactions.inTransaction(connectionProvider, conn -> {
        if (ledger.markFailed(conn, claimed.ref(), nextAttemptAt, error) != 1) {
          return false;
        }
        if (dead) {
          ledger.markDead(conn, claimed.ref(), error, now);
          if (claimed.action() instanceof CandidateAction.SendCampaignMessage campaignMessage) {
            if (classification.isRetryable()) {
              progressor.advance(conn, campaignMessage.subscriptionId(), campaignMessage.sequenceIndex(), now);
            } else {
              progressor.unsubscribe(conn, campaignMessage.subscriptionId(), now);
            }
          }
        }
        if (message != null) {
          ledger.appendMessageLog(conn, logEntry(claimed, message, DeliveryStatus.FAILED, null, error, now));
        }
        return true;
      });
      if (!resolved) {
        logger.log(Level.WARNING, "Record {0} is no longer CLAIMED; failure not recorded", claimed.ref());
        return ExecutionStatus.CLAIMED;
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record failure for record " + claimed.ref(), e);
      return ExecutionStatus.CLAIMED;
    }
    if (dead) {
      metrics.incrementDispatchDead();
      logger.log(Level.SEVERE, "Record {0} moved to DEAD after {1} attempt(s): {2}",
          new Object[] {claimed.ref(), attempts, error});
      return ExecutionStatus.DEAD;
    }
    metrics.incrementDispatchFailure();
    logger.log(Level.WARNING, "Record {0} failed attempt {1}, next attempt at {2}: {3}",
        new Object[] {claimed.ref(), attempts, nextAttemptAt, error});
    return ExecutionStatus.FAILED;
  }

  private static MessageLogEntry logEntry(ClaimedAction claimed, RenderedMessage message,
      DeliveryStatus status, String providerId, String error, Instant at) {
    return new MessageLogEntry(Ids.newId(), claimed.tenantId(), claimed.subjectId(), claimed.ref(),
        message.channel(), message.recipient(), status, providerId, error, at);
  }

  private static String describe(Throwable t) {
    if (t == null) {
      return "unknown error";
    }
    return t.getMessage() != null ? t.getClass().getSimpleName() + ": " + t.getMessage()
        : t.getClass().getSimpleName();
  }

  /**
   * Stops the transport threads. Calls still in flight are interrupted.
   */
  @Override
  public void close() {
    transportExecutor.shutdownNow();
    try {
      transportExecutor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link ActionDispatcher}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ExecutionLedger ledger;
    private RuleStore ruleStore;
    private SubjectStore subjectStore;
    private CampaignProgressor progressor;
    private MessageRenderer renderer;
    private MessageTransport transport;
    private ClockSource clockSource;
    private RetryPolicy retryPolicy;
    private int attemptCeiling = 5;
    private Duration transportTimeout = Duration.ofSeconds(30);
    private MetricsExporter metrics;
    private StageTransitionListener stageTransitionListener;

    private Builder() {
    }

    /**
     * Sets the connection provider used for resolution transactions.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the ledger whose records are resolved.
     *
     * <p><b>Required.</b>
     *
     * @param ledger the execution ledger
     * @return this builder
     */
    public Builder ledger(ExecutionLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    /**
     * Sets the rule store used to look up campaign content items.
     *
     * <p><b>Required.</b>
     *
     * @param ruleStore the rule store
     * @return this builder
     */
    public Builder ruleStore(RuleStore ruleStore) {
      this.ruleStore = ruleStore;
      return this;
    }

    /**
     * Sets the subject store used for recipients and stage transitions.
     *
     * <p><b>Required.</b>
     *
     * @param subjectStore the subject store
     * @return this builder
     */
    public Builder subjectStore(SubjectStore subjectStore) {
      this.subjectStore = subjectStore;
      return this;
    }

    /**
     * Sets the progressor that advances or unsubscribes campaign subscriptions.
     *
     * <p><b>Required.</b>
     *
     * @param progressor the campaign progressor
     * @return this builder
     */
    public Builder progressor(CampaignProgressor progressor) {
      this.progressor = progressor;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param renderer the template renderer
     * @return this builder
     */
    public Builder renderer(MessageRenderer renderer) {
      this.renderer = renderer;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param transport the outbound message transport
     * @return this builder
     */
    public Builder transport(MessageTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param clockSource the clock
     * @return this builder
     */
    public Builder clockSource(ClockSource clockSource) {
      this.clockSource = clockSource;
      return this;
    }

    /**
     * Sets the backoff for FAILED records.
     *
     * <p>Optional. Defaults to exponential backoff from 1 minute up to 1 hour.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the number of FAILED transitions after which a record becomes DEAD.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param attemptCeiling maximum attempts
     * @return this builder
     */
    public Builder attemptCeiling(int attemptCeiling) {
      this.attemptCeiling = attemptCeiling;
      return this;
    }

    /**
     * Sets the bound on a single transport call.
     *
     * <p>Optional. Defaults to 30 seconds. Must be positive.
     *
     * @param transportTimeout transport timeout
     * @return this builder
     */
    public Builder transportTimeout(Duration transportTimeout) {
      this.transportTimeout = transportTimeout;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the callback invoked after a committed stage transition.
     *
     * <p>Optional. Defaults to no callback.
     *
     * @param stageTransitionListener the listener
     * @return this builder
     */
    public Builder stageTransitionListener(StageTransitionListener stageTransitionListener) {
      this.stageTransitionListener = stageTransitionListener;
      return this;
    }

    public ActionDispatcher build() {
      return new ActionDispatcher(this);
    }
  }
}
