package io.automation.model;

import java.util.Objects;

/**
 * Outcome of an atomic claim.
 *
 * <ul>
 *   <li>{@link Granted}: this caller inserted the record and owns its execution.</li>
 *   <li>{@link AlreadyClaimed}: a record for the key exists (or the subscription index
 *       moved on); the candidate is dropped silently.</li>
 * </ul>
 */
public sealed interface ClaimResult permits ClaimResult.Granted, ClaimResult.AlreadyClaimed {

  AlreadyClaimed ALREADY_CLAIMED = new AlreadyClaimed();

  static Granted granted(RecordRef ref) {
    return new Granted(ref);
  }

  static AlreadyClaimed alreadyClaimed() {
    return ALREADY_CLAIMED;
  }

  record Granted(RecordRef ref) implements ClaimResult {
    public Granted {
      Objects.requireNonNull(ref, "ref");
    }
  }

  record AlreadyClaimed() implements ClaimResult {
  }
}
