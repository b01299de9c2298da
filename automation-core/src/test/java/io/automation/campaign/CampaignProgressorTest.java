package io.automation.campaign;

import io.automation.Candidate;
import io.automation.CandidateAction;
import io.automation.model.ApprovalStatus;
import io.automation.model.Cadence;
import io.automation.model.Campaign;
import io.automation.model.CampaignContentItem;
import io.automation.model.CampaignStatus;
import io.automation.model.NaturalKey;
import io.automation.model.Subject;
import io.automation.model.SubjectStatus;
import io.automation.model.Subscription;
import io.automation.rules.InMemoryRuleStore;
import io.automation.support.Fixtures;
import io.automation.support.InMemorySubjectStore;
import io.automation.support.InMemorySubscriptionStore;
import io.automation.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.automation.support.Fixtures.TENANT;
import static io.automation.support.StubConnections.stubCp;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CampaignProgressorTest {
  private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");
  private static final Instant T0 = Instant.parse("2025-03-20T09:00:00Z");

  private final InMemoryRuleStore rules = new InMemoryRuleStore();
  private final InMemorySubjectStore subjects = new InMemorySubjectStore();
  private final InMemorySubscriptionStore subscriptions = new InMemorySubscriptionStore();
  private final MutableClock clock = new MutableClock(T0, BERLIN);
  private final CampaignProgressor progressor = newProgressor(200);

  @Test
  void builderRejectsNonPositiveBatchSize() {
    assertThrows(IllegalArgumentException.class, () -> newProgressor(0));
  }

  // ── Enrollment ──────────────────────────────────────────────────

  @Test
  void enrollBindsToCurrentVersionAndAppliesInitialDelay() {
    Campaign base = Fixtures.campaign("drip", "inquiry", Cadence.weeks(1));
    rules.putCampaign(new Campaign("drip", TENANT, "drip", "drip", "inquiry", null, CampaignStatus.ACTIVE,
        base.cadence(), base.maxDuration(), Duration.ofHours(2), 1, null, true), Fixtures.approvedItems("drip", 2));
    subjects.put(Fixtures.subject("p1", "inquiry", T0));

    Optional<Subscription> enrolled = progressor.enroll(enrollment("p1", "drip"), T0);

    assertTrue(enrolled.isPresent());
    assertEquals("drip", enrolled.get().campaignId());
    assertEquals(0, enrolled.get().nextIndex());
    assertEquals(T0.plus(Duration.ofHours(2)), enrolled.get().nextSendAt());
  }

  @Test
  void liveSubscriptionBlocksSecondEnrollment() {
    rules.putCampaign(Fixtures.campaign("drip", "inquiry", Cadence.weeks(1)), Fixtures.approvedItems("drip", 2));
    subjects.put(Fixtures.subject("p1", "inquiry", T0));

    assertTrue(progressor.enroll(enrollment("p1", "drip"), T0).isPresent());
    assertFalse(progressor.enroll(enrollment("p1", "drip"), T0.plusSeconds(60)).isPresent());
    assertEquals(1, subscriptions.all().size());
  }

  @Test
  void completedSubjectIsEnrolledIntoNewerVersion() throws SQLException {
    rules.putCampaign(Fixtures.campaign("drip", "inquiry", Cadence.weeks(1)), Fixtures.approvedItems("drip", 2));
    subjects.put(Fixtures.subject("p1", "inquiry", T0));
    Subscription first = progressor.enroll(enrollment("p1", "drip"), T0).orElseThrow();
    subscriptions.complete(null, first.id(), T0.plus(Duration.ofDays(7)));

    assertFalse(progressor.enroll(enrollment("p1", "drip"), T0.plus(Duration.ofDays(8))).isPresent());

    Campaign v2 = publishNewVersion();
    Optional<Subscription> second = progressor.enroll(enrollment("p1", "drip"), T0.plus(Duration.ofDays(9)));

    assertTrue(second.isPresent());
    assertEquals(v2.id(), second.get().campaignId());
    assertEquals(2, subscriptions.all().size());
  }

  @Test
  void unsubscribedSubjectStaysOutOfLineage() throws SQLException {
    rules.putCampaign(Fixtures.campaign("drip", "inquiry", Cadence.weeks(1)), Fixtures.approvedItems("drip", 2));
    subjects.put(Fixtures.subject("p1", "inquiry", T0));
    Subscription first = progressor.enroll(enrollment("p1", "drip"), T0).orElseThrow();
    assertTrue(progressor.unsubscribe(first.id()));

    publishNewVersion();

    assertFalse(progressor.enroll(enrollment("p1", "drip"), T0.plus(Duration.ofDays(1))).isPresent());
    assertEquals(1, subscriptions.all().size());
  }

  @Test
  void pausedCampaignDoesNotEnroll() {
    Campaign base = Fixtures.campaign("drip", "inquiry", Cadence.weeks(1));
    rules.putCampaign(withStatus(base, CampaignStatus.PAUSED), Fixtures.approvedItems("drip", 2));

    assertFalse(progressor.enroll(enrollment("p1", "drip"), T0).isPresent());
  }

  @Test
  void enrollRejectsOtherActions() {
    Candidate notEnrollment = new Candidate(new NaturalKey.Communication("p1", "s1"), TENANT, "p1", "r1",
        new CandidateAction.ChangeStage("booked"), T0, null);

    assertThrows(IllegalArgumentException.class, () -> progressor.enroll(notEnrollment, T0));
  }

  // ── Progress decisions ──────────────────────────────────────────

  @Test
  void dueApprovedItemEmitsDeliveryCandidate() {
    Subscription subscription = subscribe(3, T0);

    ProgressDecision decision = progressor.progress(subscription, T0);

    Candidate candidate = assertInstanceOf(ProgressDecision.Emit.class, decision).candidate();
    assertEquals(new NaturalKey.Delivery(subscription.id(), "drip-item-0"), candidate.key());
    assertEquals(new CandidateAction.SendCampaignMessage("drip", subscription.id(), "drip-item-0", 0),
        candidate.action());
    assertEquals(T0, candidate.desiredAt());
  }

  @Test
  void unapprovedItemHoldsWithoutAdvancing() {
    rules.putCampaign(Fixtures.campaign("drip", "inquiry", Cadence.weeks(1)),
        List.of(Fixtures.item("drip", 0, ApprovalStatus.PENDING)));
    subjects.put(Fixtures.subject("p1", "inquiry", T0));
    Subscription subscription = insert(new Subscription("sub-1", TENANT, "drip", "drip", "p1", 0, T0, T0, null, null));

    assertInstanceOf(ProgressDecision.Hold.class, progressor.progress(subscription, T0));
    assertTrue(progressor.dueCandidates(T0).isEmpty());
    assertTrue(subscriptions.get("sub-1").isLive());
  }

  @Test
  void pausedCampaignHoldsLiveSubscriptions() {
    Subscription subscription = subscribe(3, T0);
    rules.putCampaign(withStatus(Fixtures.campaign("drip", "inquiry", Cadence.weeks(1)), CampaignStatus.PAUSED),
        Fixtures.approvedItems("drip", 3));

    assertInstanceOf(ProgressDecision.Hold.class, progressor.progress(subscription, T0));
  }

  @Test
  void passedAnchorDateCompletes() {
    Subscription subscription = subscribe(3, T0);
    subjects.put(Fixtures.subject("p1", "inquiry", T0, LocalDate.of(2025, 3, 20)));

    assertInstanceOf(ProgressDecision.Complete.class, progressor.progress(subscription, T0));
  }

  @Test
  void futureAnchorDateDoesNotComplete() {
    Subscription subscription = subscribe(3, T0);
    subjects.put(Fixtures.subject("p1", "inquiry", T0, LocalDate.of(2025, 3, 21)));

    assertInstanceOf(ProgressDecision.Emit.class, progressor.progress(subscription, T0));
  }

  @Test
  void exceededMaxDurationCompletes() {
    Subscription subscription = subscribe(3, T0);

    assertInstanceOf(ProgressDecision.Complete.class,
        progressor.progress(subscription, T0.plus(Duration.ofDays(366))));
  }

  @Test
  void inactiveSubjectCompletes() {
    Subscription subscription = subscribe(3, T0);
    Subject s = subjects.get("p1");
    subjects.put(new Subject(s.id(), TENANT, s.projectType(), s.stageId(), s.stageEnteredAt(), null,
        SubjectStatus.COMPLETED, s.email(), null, true, false));

    assertInstanceOf(ProgressDecision.Complete.class, progressor.progress(subscription, T0));
  }

  @Test
  void dueCandidatesCompletesExhaustedSequence() {
    subscribe(0, T0);

    assertTrue(progressor.dueCandidates(T0).isEmpty());
    assertNotNull(subscriptions.get("sub-1").completedAt());
  }

  @Test
  void dueCandidatesSkipsSubscriptionsNotYetDue() {
    subscribe(3, T0.plusSeconds(3600));

    assertTrue(progressor.dueCandidates(T0).isEmpty());
  }

  @Test
  void dueCandidatesPagesThroughAllSubscriptions() {
    CampaignProgressor paging = newProgressor(2);
    rules.putCampaign(Fixtures.campaign("drip", "inquiry", Cadence.weeks(1)), Fixtures.approvedItems("drip", 1));
    for (int i = 0; i < 5; i++) {
      subjects.put(Fixtures.subject("p" + i, "inquiry", T0));
      insert(new Subscription("sub-" + i, TENANT, "drip", "drip", "p" + i, 0, T0, T0, null, null));
    }

    List<Candidate> due = paging.dueCandidates(T0);

    List<String> subjectsSeen = new ArrayList<>();
    due.forEach(c -> subjectsSeen.add(c.subjectId()));
    assertEquals(List.of("p0", "p1", "p2", "p3", "p4"), subjectsSeen);
  }

  // ── Advance and unsubscribe ─────────────────────────────────────

  @Test
  void advanceUsesTenantLocalWeeksAcrossDstChange() {
    // 2025-03-30 is the spring-forward date in Berlin
    Subscription subscription = subscribe(3, T0);

    progressor.advance(null, subscription.id(), 0, T0);
    progressor.advance(null, subscription.id(), 1, T0.plus(Duration.ofDays(7)));

    Subscription advanced = subscriptions.get(subscription.id());
    assertEquals(2, advanced.nextIndex());
    assertEquals(T0.plus(Duration.ofDays(14)).minus(Duration.ofHours(1)), advanced.nextSendAt());
    assertEquals(10, advanced.nextSendAt().atZone(BERLIN).getHour());
  }

  @Test
  void advanceIgnoresStaleIndex() {
    Subscription subscription = subscribe(3, T0);
    progressor.advance(null, subscription.id(), 0, T0);

    progressor.advance(null, subscription.id(), 0, T0);

    assertEquals(1, subscriptions.get(subscription.id()).nextIndex());
  }

  @Test
  void advancingPastLastItemCompletes() {
    Subscription subscription = subscribe(1, T0);

    progressor.advance(null, subscription.id(), 0, T0);

    assertNotNull(subscriptions.get(subscription.id()).completedAt());
  }

  @Test
  void unsubscribedSubscriptionIsNeverDue() {
    Subscription subscription = subscribe(3, T0);

    assertTrue(progressor.unsubscribe(subscription.id()));
    assertFalse(progressor.unsubscribe(subscription.id()));
    assertTrue(progressor.dueCandidates(T0.plus(Duration.ofDays(30))).isEmpty());
  }

  private Subscription subscribe(int items, Instant nextSendAt) {
    rules.putCampaign(Fixtures.campaign("drip", "inquiry", Cadence.weeks(1)), Fixtures.approvedItems("drip", items));
    subjects.put(Fixtures.subject("p1", "inquiry", T0));
    return insert(new Subscription("sub-1", TENANT, "drip", "drip", "p1", 0, nextSendAt, T0, null, null));
  }

  private Subscription insert(Subscription subscription) {
    subscriptions.insert(null, subscription);
    return subscription;
  }

  private Campaign publishNewVersion() throws SQLException {
    return new CampaignVersioner(stubCp(), rules, clock).publish("drip", List.of(
        new CampaignVersioner.ContentDraft("New 0", "V2 body 0", null, ApprovalStatus.APPROVED)),
        "editor", "refresh");
  }

  private static Candidate enrollment(String subjectId, String lineageId) {
    return new Candidate(new NaturalKey.Enrollment(subjectId, lineageId), TENANT, subjectId, "n1",
        new CandidateAction.EnrollInCampaign(lineageId), T0, null);
  }

  private static Campaign withStatus(Campaign c, CampaignStatus status) {
    return new Campaign(c.id(), c.tenantId(), c.lineageId(), c.name(), c.targetStageId(), c.projectType(), status,
        c.cadence(), c.maxDuration(), c.initialDelay(), c.version(), c.parentVersionId(), c.currentVersion());
  }

  private CampaignProgressor newProgressor(int batchSize) {
    return CampaignProgressor.builder()
        .connectionProvider(stubCp())
        .ruleStore(rules)
        .subjectStore(subjects)
        .subscriptionStore(subscriptions)
        .clockSource(clock)
        .batchSize(batchSize)
        .build();
  }
}
