package io.automation.dispatch;

import io.automation.Candidate;
import io.automation.CandidateAction;
import io.automation.model.LedgerRecord;
import io.automation.model.RecordRef;

import java.util.Objects;

/**
 * A ledger record this worker owns (status CLAIMED) together with the action to perform.
 *
 * @param ref       the claimed record
 * @param tenantId  owning tenant
 * @param subjectId subject record the action applies to
 * @param ruleId    originating rule, or {@code null} for campaign deliveries
 * @param action    side effect to perform
 * @param attempts  failed attempts recorded before this one
 */
public record ClaimedAction(
    RecordRef ref,
    String tenantId,
    String subjectId,
    String ruleId,
    CandidateAction action,
    int attempts
) {

  public ClaimedAction {
    Objects.requireNonNull(ref, "ref");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(subjectId, "subjectId");
    Objects.requireNonNull(action, "action");
  }

  public static ClaimedAction granted(RecordRef ref, Candidate candidate) {
    return new ClaimedAction(ref, candidate.tenantId(), candidate.subjectId(),
        candidate.ruleId(), candidate.action(), 0);
  }

  public static ClaimedAction of(LedgerRecord record) {
    return new ClaimedAction(record.ref(), record.tenantId(), record.subjectId(),
        record.ruleId(), record.action(), record.attempts());
  }
}
