package io.automation.model;

import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Kind-specific payload of a {@link Rule}. Evaluation dispatches on the concrete variant.
 *
 * <ul>
 *   <li>{@link Communication}: ordered steps sent after a subject enters a stage.</li>
 *   <li>{@link StageChange}: moves a subject to a target stage when a bound business event fires.</li>
 *   <li>{@link Countdown}: one message relative to the subject's anchor date.</li>
 *   <li>{@link Nurture}: enrolls subjects into the current version of a campaign lineage.</li>
 * </ul>
 */
public sealed interface RuleSpec
    permits RuleSpec.Communication, RuleSpec.StageChange, RuleSpec.Countdown, RuleSpec.Nurture {

  RuleKind kind();

  /**
   * @param stageId    stage whose entry triggers the steps
   * @param channel    channel every step is sent on
   * @param anchorDate anchor-date precondition on the subject
   * @param steps      steps ordered by sequence index
   */
  record Communication(
      String stageId,
      Channel channel,
      AnchorDatePrecondition anchorDate,
      List<Step> steps
  ) implements RuleSpec {
    public Communication {
      Objects.requireNonNull(stageId, "stageId");
      Objects.requireNonNull(channel, "channel");
      anchorDate = anchorDate == null ? AnchorDatePrecondition.ANY : anchorDate;
      steps = steps == null ? List.of() : List.copyOf(steps);
    }

    @Override
    public RuleKind kind() {
      return RuleKind.COMMUNICATION;
    }
  }

  /**
   * @param targetStageId stage the subject is moved to
   * @param bindings      business event bindings; at most one per event kind
   */
  record StageChange(String targetStageId, List<BusinessTriggerBinding> bindings) implements RuleSpec {
    public StageChange {
      Objects.requireNonNull(targetStageId, "targetStageId");
      bindings = bindings == null ? List.of() : List.copyOf(bindings);
      Set<BusinessEventKind> seen = EnumSet.noneOf(BusinessEventKind.class);
      for (BusinessTriggerBinding binding : bindings) {
        if (!seen.add(binding.kind())) {
          throw new IllegalArgumentException("Duplicate binding for event kind " + binding.kind());
        }
      }
    }

    public BusinessTriggerBinding bindingFor(BusinessEventKind kind) {
      for (BusinessTriggerBinding binding : bindings) {
        if (binding.kind() == kind) {
          return binding;
        }
      }
      return null;
    }

    @Override
    public RuleKind kind() {
      return RuleKind.STAGE_CHANGE;
    }
  }

  /**
   * @param channel        channel the message is sent on
   * @param templateId     template rendered for the message
   * @param offsetDays     non-negative number of days from the anchor date
   * @param timing         whether the offset is applied before or after the anchor date
   * @param triggerTime    tenant-local time of day the message fires
   * @param stageCondition stage the subject must currently be in, or {@code null} for any
   */
  record Countdown(
      Channel channel,
      String templateId,
      int offsetDays,
      CountdownTiming timing,
      LocalTime triggerTime,
      String stageCondition
  ) implements RuleSpec {
    public Countdown {
      Objects.requireNonNull(channel, "channel");
      Objects.requireNonNull(templateId, "templateId");
      Objects.requireNonNull(timing, "timing");
      Objects.requireNonNull(triggerTime, "triggerTime");
      if (offsetDays < 0) {
        throw new IllegalArgumentException("offsetDays must be >= 0");
      }
    }

    public int signedOffsetDays() {
      return timing == CountdownTiming.BEFORE ? -offsetDays : offsetDays;
    }

    @Override
    public RuleKind kind() {
      return RuleKind.COUNTDOWN;
    }
  }

  /**
   * @param campaignLineageId lineage whose current version new subjects are enrolled into
   */
  record Nurture(String campaignLineageId) implements RuleSpec {
    public Nurture {
      Objects.requireNonNull(campaignLineageId, "campaignLineageId");
    }

    @Override
    public RuleKind kind() {
      return RuleKind.NURTURE;
    }
  }
}
