package io.automation;

import io.automation.model.NaturalKey;
import io.automation.model.QuietHours;

import java.time.Instant;
import java.util.Objects;

/**
 * An unclaimed, proposed action. Candidates are hints: producing the same candidate
 * twice is harmless because claiming its natural key is the only commit point.
 *
 * @param key         natural idempotency key
 * @param tenantId    owning tenant
 * @param subjectId   subject record the action applies to
 * @param ruleId      originating rule, or {@code null} for campaign deliveries
 * @param action      proposed side effect
 * @param desiredAt   desired execution time before quiet-hour adjustment
 * @param quietHours  quiet-hour window to respect, or {@code null}
 */
public record Candidate(
    NaturalKey key,
    String tenantId,
    String subjectId,
    String ruleId,
    CandidateAction action,
    Instant desiredAt,
    QuietHours quietHours
) {

  public Candidate {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(subjectId, "subjectId");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(desiredAt, "desiredAt");
  }
}
