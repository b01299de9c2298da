package io.automation.model;

import java.util.Objects;

/**
 * Associates a STAGE_CHANGE rule with one business event kind plus optional constraints.
 *
 * @param kind           the event kind this binding listens for
 * @param minAmountCents minimum payload amount, or {@code null} for no constraint
 * @param subtype        required payload subtype, or {@code null} for any
 */
public record BusinessTriggerBinding(BusinessEventKind kind, Long minAmountCents, String subtype) {

  public BusinessTriggerBinding {
    Objects.requireNonNull(kind, "kind");
    if (minAmountCents != null && minAmountCents < 0) {
      throw new IllegalArgumentException("minAmountCents must be >= 0");
    }
  }

  public static BusinessTriggerBinding on(BusinessEventKind kind) {
    return new BusinessTriggerBinding(kind, null, null);
  }

  /**
   * Returns {@code true} if the payload satisfies every constraint of this binding.
   * A missing amount never satisfies a minimum.
   */
  public boolean matches(BusinessEventPayload payload) {
    BusinessEventPayload p = payload == null ? BusinessEventPayload.EMPTY : payload;
    if (minAmountCents != null && (p.amountCents() == null || p.amountCents() < minAmountCents)) {
      return false;
    }
    return subtype == null || subtype.equals(p.subtype());
  }
}
