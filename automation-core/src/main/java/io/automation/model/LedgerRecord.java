package io.automation.model;

import io.automation.CandidateAction;

import java.time.Instant;

/**
 * Read-only view of a persisted execution or delivery record.
 *
 * @see io.automation.spi.ExecutionLedger
 */
public record LedgerRecord(
    RecordRef ref,
    String tenantId,
    String subjectId,
    String ruleId,
    String naturalKey,
    CandidateAction action,
    ExecutionStatus status,
    int attempts,
    Instant claimedAt,
    Instant nextAttemptAt,
    Instant resolvedAt,
    String providerId,
    String lastError
) {}
