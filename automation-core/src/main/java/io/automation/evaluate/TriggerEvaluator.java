package io.automation.evaluate;

import io.automation.Candidate;
import io.automation.CandidateAction;
import io.automation.LifecycleEvent;
import io.automation.model.BusinessTriggerBinding;
import io.automation.model.Campaign;
import io.automation.model.CampaignStatus;
import io.automation.model.Channel;
import io.automation.model.NaturalKey;
import io.automation.model.Rule;
import io.automation.model.RuleKind;
import io.automation.model.RuleSpec;
import io.automation.model.Step;
import io.automation.model.Subject;
import io.automation.spi.ClockSource;
import io.automation.spi.RuleStore;
import io.automation.spi.SubjectStore;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns lifecycle events into unclaimed {@link Candidate}s.
 *
 * <p>The evaluator holds no state between calls; it reads rules, campaigns and subjects
 * from their stores and emits one candidate per natural key that is due. Emitting the
 * same candidate on several ticks or from several workers is expected: claiming the
 * key in the ledger is the only commit point.
 *
 * <ul>
 *   <li><b>Stage entered</b>: COMMUNICATION steps of the stage and NURTURE enrollments
 *       for campaigns targeting the stage.</li>
 *   <li><b>Business event</b>: STAGE_CHANGE rules bound to the event kind whose
 *       constraints the payload satisfies.</li>
 *   <li><b>Clock tick</b>: COUNTDOWN messages whose trigger instant falls in the tick
 *       window, plus COMMUNICATION steps and NURTURE enrollments re-derived from current
 *       stage membership so delayed steps and missed events are picked up.</li>
 * </ul>
 *
 * <p>Message candidates are only emitted for subjects that opted in to the channel and
 * have an address for it.
 */
public final class TriggerEvaluator {
  private static final Logger logger = Logger.getLogger(TriggerEvaluator.class.getName());

  private final RuleStore ruleStore;
  private final SubjectStore subjectStore;
  private final ClockSource clockSource;

  public TriggerEvaluator(RuleStore ruleStore, SubjectStore subjectStore, ClockSource clockSource) {
    this.ruleStore = Objects.requireNonNull(ruleStore, "ruleStore");
    this.subjectStore = Objects.requireNonNull(subjectStore, "subjectStore");
    this.clockSource = Objects.requireNonNull(clockSource, "clockSource");
  }

  /**
   * Evaluates one event.
   *
   * @param event the lifecycle event
   * @return candidates in rule order; empty if nothing applies
   */
  public List<Candidate> evaluate(LifecycleEvent event) {
    Objects.requireNonNull(event, "event");
    if (event instanceof LifecycleEvent.StageEntered stageEntered) {
      return onStageEntered(stageEntered);
    }
    if (event instanceof LifecycleEvent.BusinessEventFired fired) {
      return onBusinessEvent(fired);
    }
    return onClockTick((LifecycleEvent.ClockTick) event);
  }

  private List<Candidate> onStageEntered(LifecycleEvent.StageEntered event) {
    Optional<Subject> found = activeSubject(event.tenantId(), event.subjectId());
    if (found.isEmpty()) {
      return List.of();
    }
    Subject subject = found.get();
    List<Candidate> out = new ArrayList<>();
    for (Rule rule : ruleStore.rules(event.tenantId(), RuleKind.COMMUNICATION)) {
      communication(rule, subject, event.stageId(), event.occurredAt(), out);
    }
    for (Rule rule : ruleStore.rules(event.tenantId(), RuleKind.NURTURE)) {
      nurture(rule, subject, event.stageId(), event.occurredAt(), out);
    }
    return out;
  }

  private List<Candidate> onBusinessEvent(LifecycleEvent.BusinessEventFired event) {
    Optional<Subject> found = activeSubject(event.tenantId(), event.subjectId());
    if (found.isEmpty()) {
      return List.of();
    }
    Subject subject = found.get();
    List<Candidate> out = new ArrayList<>();
    for (Rule rule : ruleStore.rules(event.tenantId(), RuleKind.STAGE_CHANGE)) {
      if (!rule.enabled() || !rule.isEffectiveAt(event.occurredAt())
          || !rule.appliesToProjectType(subject.projectType())) {
        continue;
      }
      RuleSpec.StageChange spec = (RuleSpec.StageChange) rule.spec();
      BusinessTriggerBinding binding = spec.bindingFor(event.kind());
      if (binding == null || !binding.matches(event.payload())) {
        continue;
      }
      if (spec.targetStageId().equals(subject.stageId())) {
        logger.log(Level.FINE, "Subject {0} already in stage {1}; rule {2} skipped",
            new Object[] {subject.id(), spec.targetStageId(), rule.id()});
        continue;
      }
      out.add(new Candidate(
          new NaturalKey.StageChange(subject.id(), rule.id(), event.kind()),
          event.tenantId(), subject.id(), rule.id(),
          new CandidateAction.ChangeStage(spec.targetStageId()),
          event.occurredAt(), null));
    }
    return out;
  }

  private List<Candidate> onClockTick(LifecycleEvent.ClockTick tick) {
    List<Candidate> out = new ArrayList<>();
    countdowns(tick, out);

    for (Rule rule : ruleStore.rules(tick.tenantId(), RuleKind.COMMUNICATION)) {
      if (!rule.enabled()) {
        continue;
      }
      String stageId = ((RuleSpec.Communication) rule.spec()).stageId();
      for (Subject subject : subjectStore.findInStage(tick.tenantId(), stageId)) {
        if (subject.isActive()) {
          communication(rule, subject, stageId, subject.stageEnteredAt(), out);
        }
      }
    }

    for (Rule rule : ruleStore.rules(tick.tenantId(), RuleKind.NURTURE)) {
      if (!rule.enabled()) {
        continue;
      }
      String lineageId = ((RuleSpec.Nurture) rule.spec()).campaignLineageId();
      Optional<Campaign> campaign = ruleStore.currentCampaign(tick.tenantId(), lineageId);
      if (campaign.isEmpty() || campaign.get().status() != CampaignStatus.ACTIVE) {
        continue;
      }
      String stageId = campaign.get().targetStageId();
      for (Subject subject : subjectStore.findInStage(tick.tenantId(), stageId)) {
        if (subject.isActive()) {
          nurture(rule, subject, stageId, subject.stageEnteredAt(), out);
        }
      }
    }
    return out;
  }

  private void countdowns(LifecycleEvent.ClockTick tick, List<Candidate> out) {
    List<Rule> rules = ruleStore.rules(tick.tenantId(), RuleKind.COUNTDOWN).stream()
        .filter(Rule::enabled)
        .toList();
    if (rules.isEmpty()) {
      return;
    }
    ZoneId zone = clockSource.zoneOf(tick.tenantId());
    for (Subject subject : subjectStore.findWithAnchorDate(tick.tenantId())) {
      if (!subject.isActive() || subject.anchorDate() == null) {
        continue;
      }
      for (Rule rule : rules) {
        RuleSpec.Countdown spec = (RuleSpec.Countdown) rule.spec();
        if (!rule.appliesToProjectType(subject.projectType())) {
          continue;
        }
        if (spec.stageCondition() != null && !spec.stageCondition().equals(subject.stageId())) {
          continue;
        }
        if (!subject.isReachable(spec.channel())) {
          continue;
        }
        Instant fireAt = fireInstant(subject.anchorDate(), spec, zone);
        if (!tick.contains(fireAt) || !rule.isEffectiveAt(fireAt)) {
          continue;
        }
        out.add(new Candidate(
            new NaturalKey.Countdown(subject.id(), rule.id(), subject.anchorDate(), spec.offsetDays()),
            tick.tenantId(), subject.id(), rule.id(),
            new CandidateAction.SendMessage(spec.channel(), spec.templateId()),
            fireAt, null));
      }
    }
  }

  /**
   * Returns the instant a countdown rule fires for an anchor date: the tenant-local
   * trigger time on {@code anchorDate} shifted by the signed offset.
   */
  public static Instant fireInstant(LocalDate anchorDate, RuleSpec.Countdown spec, ZoneId zone) {
    LocalDate offsetDate = anchorDate.plusDays(spec.signedOffsetDays());
    return ZonedDateTime.of(offsetDate, spec.triggerTime(), zone).toInstant();
  }

  private void communication(Rule rule, Subject subject, String stageId, Instant enteredAt,
      List<Candidate> out) {
    RuleSpec.Communication spec = (RuleSpec.Communication) rule.spec();
    if (!rule.enabled()
        || !spec.stageId().equals(stageId)
        || !rule.isEffectiveAt(enteredAt)
        || !rule.appliesToProjectType(subject.projectType())
        || !spec.anchorDate().test(subject)
        || !subject.isReachable(spec.channel())) {
      return;
    }
    for (Step step : spec.steps()) {
      if (!step.enabled()) {
        continue;
      }
      out.add(new Candidate(
          new NaturalKey.Communication(subject.id(), step.id()),
          subject.tenantId(), subject.id(), rule.id(),
          new CandidateAction.SendMessage(spec.channel(), step.templateId()),
          enteredAt.plus(step.delayFromTrigger()),
          step.quietHours()));
    }
  }

  private void nurture(Rule rule, Subject subject, String stageId, Instant enteredAt,
      List<Candidate> out) {
    if (!rule.enabled() || !rule.isEffectiveAt(enteredAt)
        || !rule.appliesToProjectType(subject.projectType())) {
      return;
    }
    String lineageId = ((RuleSpec.Nurture) rule.spec()).campaignLineageId();
    Optional<Campaign> found = ruleStore.currentCampaign(subject.tenantId(), lineageId);
    if (found.isEmpty()) {
      return;
    }
    Campaign campaign = found.get();
    if (campaign.status() != CampaignStatus.ACTIVE
        || !campaign.targetStageId().equals(stageId)
        || !campaign.appliesToProjectType(subject.projectType())
        || !subject.isReachable(Channel.EMAIL)) {
      return;
    }
    out.add(new Candidate(
        new NaturalKey.Enrollment(subject.id(), lineageId),
        subject.tenantId(), subject.id(), rule.id(),
        new CandidateAction.EnrollInCampaign(lineageId),
        enteredAt, null));
  }

  private Optional<Subject> activeSubject(String tenantId, String subjectId) {
    Optional<Subject> subject = subjectStore.find(tenantId, subjectId);
    if (subject.isEmpty() || !subject.get().isActive()) {
      logger.log(Level.FINE, "Subject {0} missing or inactive; no candidates", subjectId);
      return Optional.empty();
    }
    return subject;
  }
}
