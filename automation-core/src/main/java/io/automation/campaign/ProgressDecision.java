package io.automation.campaign;

import io.automation.Candidate;

/**
 * What a tick does with one due subscription.
 */
public sealed interface ProgressDecision
    permits ProgressDecision.Complete, ProgressDecision.Hold, ProgressDecision.Emit {

  /** Set {@code completedAt}; the subscription is never processed again. */
  record Complete(String reason) implements ProgressDecision {
  }

  /** Leave the subscription untouched and re-check on the next tick. */
  record Hold(String reason) implements ProgressDecision {
  }

  /** Claim and send the item at the subscription's {@code nextIndex}. */
  record Emit(Candidate candidate) implements ProgressDecision {
  }
}
