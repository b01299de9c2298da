package io.automation.campaign;

import io.automation.Candidate;
import io.automation.CandidateAction;
import io.automation.model.Campaign;
import io.automation.model.CampaignContentItem;
import io.automation.model.CampaignStatus;
import io.automation.model.NaturalKey;
import io.automation.model.Subject;
import io.automation.model.Subscription;
import io.automation.spi.ClockSource;
import io.automation.spi.ConnectionProvider;
import io.automation.spi.MetricsExporter;
import io.automation.spi.RuleStore;
import io.automation.spi.SubjectStore;
import io.automation.spi.SubscriptionStore;
import io.automation.util.Ids;
import io.automation.util.Transactions;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Advances drip-campaign subscriptions.
 *
 * <p>Enrollment binds a subscription to the current version of a campaign lineage; the
 * subscription stays pinned to that version. On each tick, due subscriptions are either
 * completed, held, or turned into a delivery candidate for the item at {@code nextIndex}.
 * {@code nextIndex} and {@code nextSendAt} move only through {@link #advance}, which the
 * dispatcher calls inside the transaction that resolves the delivery.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class CampaignProgressor {
  private static final Logger logger = Logger.getLogger(CampaignProgressor.class.getName());

  private final ConnectionProvider connectionProvider;
  private final RuleStore ruleStore;
  private final SubjectStore subjectStore;
  private final SubscriptionStore subscriptionStore;
  private final ClockSource clockSource;
  private final MetricsExporter metrics;
  private final int batchSize;

  private CampaignProgressor(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.ruleStore = Objects.requireNonNull(builder.ruleStore, "ruleStore");
    this.subjectStore = Objects.requireNonNull(builder.subjectStore, "subjectStore");
    this.subscriptionStore = Objects.requireNonNull(builder.subscriptionStore, "subscriptionStore");
    this.clockSource = Objects.requireNonNull(builder.clockSource, "clockSource");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.batchSize = builder.batchSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Enrolls the candidate's subject into the current version of the lineage.
   *
   * <p>A subject holds at most one live subscription per lineage: the lineage check and the
   * insert run in one transaction and storage rejects a second subscription to the same
   * version. A subject that unsubscribed stays out of the lineage; one whose subscription
   * completed is enrolled again once a newer version is current.
   *
   * @param candidate an {@link CandidateAction.EnrollInCampaign} candidate
   * @param now       enrollment time
   * @return the new subscription, or empty if the campaign is not enrolling or the subject
   *     is already subscribed
   */
  public Optional<Subscription> enroll(Candidate candidate, Instant now) {
    if (!(candidate.action() instanceof CandidateAction.EnrollInCampaign enroll)) {
      throw new IllegalArgumentException("Not an enrollment candidate: " + candidate.action());
    }
    Optional<Campaign> current = ruleStore.currentCampaign(candidate.tenantId(), enroll.lineageId());
    if (current.isEmpty() || current.get().status() != CampaignStatus.ACTIVE) {
      return Optional.empty();
    }
    Campaign campaign = current.get();
    Subscription subscription = new Subscription(Ids.newId(), candidate.tenantId(), campaign.id(),
        campaign.lineageId(), candidate.subjectId(), 0, now.plus(campaign.initialDelay()),
        now, null, null);
    try {
      boolean inserted = Transactions.inTransaction(connectionProvider, conn ->
          !subscriptionStore.existsUncompletedInLineage(conn, candidate.subjectId(), campaign.lineageId())
              && subscriptionStore.insert(conn, subscription));
      if (!inserted) {
        return Optional.empty();
      }
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to enroll subject " + candidate.subjectId()
          + " into campaign " + campaign.id(), e);
      return Optional.empty();
    }
    metrics.incrementSubscriptionsEnrolled();
    logger.log(Level.INFO, "Enrolled subject {0} into campaign {1} v{2}",
        new Object[] {candidate.subjectId(), campaign.id(), campaign.version()});
    return Optional.of(subscription);
  }

  /**
   * Processes every live subscription due at {@code now}: completes finished ones and
   * returns delivery candidates for the rest. Held subscriptions are left untouched.
   */
  public List<Candidate> dueCandidates(Instant now) {
    List<Candidate> out = new ArrayList<>();
    String afterId = null;
    while (true) {
      List<Subscription> page = fetchDue(now, afterId);
      if (page == null) {
        break;
      }
      for (Subscription subscription : page) {
        try {
          ProgressDecision decision = progress(subscription, now);
          if (decision instanceof ProgressDecision.Emit emit) {
            out.add(emit.candidate());
          } else if (decision instanceof ProgressDecision.Complete complete) {
            complete(subscription, now, complete.reason());
          } else {
            logger.log(Level.FINE, "Holding subscription {0}: {1}",
                new Object[] {subscription.id(), ((ProgressDecision.Hold) decision).reason()});
          }
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Failed to progress subscription " + subscription.id(), e);
        }
      }
      if (page.size() < batchSize) {
        break;
      }
      afterId = page.get(page.size() - 1).id();
    }
    return out;
  }

  /**
   * Decides what to do with one due subscription. Reads only; writes nothing.
   */
  public ProgressDecision progress(Subscription subscription, Instant now) {
    Optional<Subject> found = subjectStore.find(subscription.tenantId(), subscription.subjectId());
    if (found.isEmpty() || !found.get().isActive()) {
      return new ProgressDecision.Complete("subject no longer active");
    }
    Subject subject = found.get();
    ZoneId zone = clockSource.zoneOf(subscription.tenantId());
    LocalDate today = now.atZone(zone).toLocalDate();
    if (subject.anchorDate() != null && !subject.anchorDate().isAfter(today)) {
      return new ProgressDecision.Complete("anchor date " + subject.anchorDate() + " passed");
    }
    Optional<Campaign> pinned = ruleStore.campaign(subscription.campaignId());
    if (pinned.isEmpty()) {
      return new ProgressDecision.Complete("campaign version " + subscription.campaignId() + " missing");
    }
    Campaign campaign = pinned.get();
    if (Duration.between(subscription.startedAt(), now).compareTo(campaign.maxDuration()) > 0) {
      return new ProgressDecision.Complete("maximum duration " + campaign.maxDuration() + " reached");
    }
    Optional<CampaignContentItem> item = CampaignContentItem.atIndex(
        ruleStore.contentItems(campaign.id()), subscription.nextIndex());
    if (item.isEmpty()) {
      return new ProgressDecision.Complete("sequence exhausted");
    }
    if (campaign.status() == CampaignStatus.PAUSED) {
      return new ProgressDecision.Hold("campaign paused");
    }
    if (!item.get().isApproved()) {
      return new ProgressDecision.Hold("item " + subscription.nextIndex() + " is " + item.get().approvalStatus());
    }
    return new ProgressDecision.Emit(new Candidate(
        new NaturalKey.Delivery(subscription.id(), item.get().id()),
        subscription.tenantId(), subscription.subjectId(), null,
        new CandidateAction.SendCampaignMessage(campaign.id(), subscription.id(), item.get().id(),
            subscription.nextIndex()),
        subscription.nextSendAt(), null));
  }

  /**
   * Moves a subscription past a resolved delivery: {@code nextIndex + 1} and
   * {@code nextSendAt + cadence} (tenant-local). Completes the subscription when the
   * pinned version has no further item. A no-op if the subscription already moved on.
   *
   * @param conn           the caller's connection, inside the resolving transaction
   * @param subscriptionId subscription to advance
   * @param deliveredIndex index of the item whose delivery was resolved
   * @param now            resolution time
   */
  public void advance(Connection conn, String subscriptionId, int deliveredIndex, Instant now) {
    Optional<Subscription> found = subscriptionStore.find(conn, subscriptionId);
    if (found.isEmpty() || !found.get().isLive() || found.get().nextIndex() != deliveredIndex) {
      return;
    }
    Subscription subscription = found.get();
    Optional<Campaign> campaign = ruleStore.campaign(subscription.campaignId());
    ZoneId zone = clockSource.zoneOf(subscription.tenantId());
    Instant nextSendAt = campaign
        .map(c -> c.cadence().next(subscription.nextSendAt(), zone))
        .orElse(subscription.nextSendAt());
    int nextIndex = deliveredIndex + 1;
    if (subscriptionStore.advance(conn, subscriptionId, deliveredIndex, nextIndex, nextSendAt) == 0) {
      return;
    }
    boolean exhausted = campaign.isEmpty() || CampaignContentItem.atIndex(
        ruleStore.contentItems(campaign.get().id()), nextIndex).isEmpty();
    if (exhausted && subscriptionStore.complete(conn, subscriptionId, now) == 1) {
      metrics.incrementSubscriptionsCompleted();
      logger.log(Level.INFO, "Subscription {0} completed: sequence exhausted", subscriptionId);
    }
  }

  /**
   * @return {@code true} if the subscription exists and is neither completed nor unsubscribed
   */
  public boolean isLive(String subscriptionId) throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> subscriptionStore.find(conn, subscriptionId))
        .map(Subscription::isLive)
        .orElse(false);
  }

  /**
   * Unsubscribes on the caller's connection. Already-sent deliveries remain as history.
   *
   * @return {@code true} if the subscription was live
   */
  public boolean unsubscribe(Connection conn, String subscriptionId, Instant now) {
    boolean updated = subscriptionStore.unsubscribe(conn, subscriptionId, now) == 1;
    if (updated) {
      logger.log(Level.INFO, "Subscription {0} unsubscribed", subscriptionId);
    }
    return updated;
  }

  /**
   * Unsubscribes in its own transaction.
   *
   * @return {@code true} if the subscription was live
   */
  public boolean unsubscribe(String subscriptionId) {
    Instant now = clockSource.now();
    try {
      return Transactions.inTransaction(connectionProvider,
          conn -> unsubscribe(conn, subscriptionId, now));
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to unsubscribe " + subscriptionId, e);
      return false;
    }
  }

  private List<Subscription> fetchDue(Instant now, String afterId) {
    try {
      return Transactions.autoCommit(connectionProvider,
          conn -> subscriptionStore.findDue(conn, now, afterId, batchSize));
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to fetch due subscriptions", e);
      return null;
    }
  }

  private void complete(Subscription subscription, Instant now, String reason) {
    try {
      int updated = Transactions.autoCommit(connectionProvider,
          conn -> subscriptionStore.complete(conn, subscription.id(), now));
      if (updated == 1) {
        metrics.incrementSubscriptionsCompleted();
        logger.log(Level.INFO, "Subscription {0} completed: {1}",
            new Object[] {subscription.id(), reason});
      }
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to complete subscription " + subscription.id(), e);
    }
  }

  /** Builder for {@link CampaignProgressor}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private RuleStore ruleStore;
    private SubjectStore subjectStore;
    private SubscriptionStore subscriptionStore;
    private ClockSource clockSource;
    private MetricsExporter metrics;
    private int batchSize = 200;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> Source of campaign versions and content items. */
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
    public Builder clockSource(ClockSource clockSource) {
      this.clockSource = clockSource;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Page size for due subscriptions. Defaults to {@code 200}. Must be &gt; 0. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public CampaignProgressor build() {
      return new CampaignProgressor(this);
    }
  }
}
