package io.automation.model;

import java.time.Duration;
import java.util.Objects;

/**
 * One message of a COMMUNICATION rule. Each step is its own idempotency unit.
 *
 * @param id               step id, part of the execution natural key
 * @param ruleId           owning rule
 * @param sequenceIndex    ordering within the rule
 * @param delayFromTrigger offset from the stage-entry time
 * @param templateId       template rendered for this step
 * @param quietHours       optional quiet-hour window, or {@code null}
 * @param enabled          disabled steps never produce candidates
 */
public record Step(
    String id,
    String ruleId,
    int sequenceIndex,
    Duration delayFromTrigger,
    String templateId,
    QuietHours quietHours,
    boolean enabled
) {

  public Step {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ruleId, "ruleId");
    Objects.requireNonNull(templateId, "templateId");
    delayFromTrigger = delayFromTrigger == null ? Duration.ZERO : delayFromTrigger;
    if (delayFromTrigger.isNegative()) {
      throw new IllegalArgumentException("delayFromTrigger must be >= 0");
    }
  }
}
