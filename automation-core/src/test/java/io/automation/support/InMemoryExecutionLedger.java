package io.automation.support;

import io.automation.Candidate;
import io.automation.CandidateAction;
import io.automation.model.ClaimResult;
import io.automation.model.ExecutionStatus;
import io.automation.model.LedgerRecord;
import io.automation.model.MessageLogEntry;
import io.automation.model.RecordRef;
import io.automation.model.RecordType;
import io.automation.model.Subscription;
import io.automation.spi.ExecutionLedger;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Ledger held in memory, with the same guarded transitions as the JDBC ledgers.
 */
public final class InMemoryExecutionLedger implements ExecutionLedger {
  private final Map<String, LedgerRecord> byKey = new LinkedHashMap<>();
  private final Map<String, String> keyById = new LinkedHashMap<>();
  private final List<MessageLogEntry> messageLog = new CopyOnWriteArrayList<>();
  private final InMemorySubscriptionStore subscriptions;

  public final AtomicInteger failedTransitions = new AtomicInteger();
  public final AtomicInteger deadTransitions = new AtomicInteger();

  public InMemoryExecutionLedger(InMemorySubscriptionStore subscriptions) {
    this.subscriptions = subscriptions;
  }

  public synchronized List<LedgerRecord> records() {
    return new ArrayList<>(byKey.values());
  }

  public synchronized Optional<LedgerRecord> byKey(String naturalKey) {
    return Optional.ofNullable(byKey.get(naturalKey));
  }

  public List<MessageLogEntry> messageLog() {
    return List.copyOf(messageLog);
  }

  /** Moves a record's claim time into the past, as if its worker had stalled. */
  public synchronized void backdateClaim(RecordRef ref, Instant claimedAt) {
    update(ref, r -> copy(r, r.status(), r.attempts(), claimedAt, r.nextAttemptAt(), r.resolvedAt(),
        r.providerId(), r.lastError()));
  }

  @Override
  public synchronized ClaimResult claim(Connection conn, Candidate candidate, Instant now) {
    if (candidate.action() instanceof CandidateAction.EnrollInCampaign) {
      throw new IllegalArgumentException("Enrollments are not claimed in the ledger: " + candidate.key());
    }
    String key = candidate.key().value();
    if (byKey.containsKey(key)) {
      return ClaimResult.alreadyClaimed();
    }
    RecordType type = RecordType.EXECUTION;
    if (candidate.action() instanceof CandidateAction.SendCampaignMessage send) {
      type = RecordType.DELIVERY;
      Subscription subscription = subscriptions == null ? null : subscriptions.get(send.subscriptionId());
      if (subscription == null || !subscription.isLive() || subscription.nextIndex() != send.sequenceIndex()) {
        return ClaimResult.alreadyClaimed();
      }
    }
    RecordRef ref = new RecordRef(type, UUID.randomUUID().toString());
    byKey.put(key, new LedgerRecord(ref, candidate.tenantId(), candidate.subjectId(), candidate.ruleId(),
        key, candidate.action(), ExecutionStatus.CLAIMED, 0, now, null, null, null, null));
    keyById.put(ref.id(), key);
    return ClaimResult.granted(ref);
  }

  @Override
  public synchronized int markSucceeded(Connection conn, RecordRef ref, String providerId, Instant resolvedAt) {
    return transition(ref, ExecutionStatus.CLAIMED, r -> copy(r, ExecutionStatus.SUCCEEDED, r.attempts(),
        r.claimedAt(), null, resolvedAt, providerId, r.lastError()));
  }

  @Override
  public synchronized int markFailed(Connection conn, RecordRef ref, Instant nextAttemptAt, String error) {
    int updated = transition(ref, ExecutionStatus.CLAIMED, r -> copy(r, ExecutionStatus.FAILED,
        r.attempts() + 1, r.claimedAt(), nextAttemptAt, null, null, error));
    failedTransitions.addAndGet(updated);
    return updated;
  }

  @Override
  public synchronized int markDead(Connection conn, RecordRef ref, String error, Instant resolvedAt) {
    int updated = transition(ref, ExecutionStatus.FAILED, r -> copy(r, ExecutionStatus.DEAD, r.attempts(),
        r.claimedAt(), null, resolvedAt, null, error));
    deadTransitions.addAndGet(updated);
    return updated;
  }

  @Override
  public synchronized int reclaim(Connection conn, RecordRef ref, Instant now) {
    LedgerRecord current = get(ref);
    if (current == null || current.status() != ExecutionStatus.FAILED
        || current.nextAttemptAt() == null || current.nextAttemptAt().isAfter(now)) {
      return 0;
    }
    update(ref, r -> copy(r, ExecutionStatus.CLAIMED, r.attempts(), now, null, null, null, r.lastError()));
    return 1;
  }

  @Override
  public synchronized List<LedgerRecord> findRetryable(Connection conn, RecordType type, Instant now, int limit) {
    return byKey.values().stream()
        .filter(r -> r.ref().type() == type && r.status() == ExecutionStatus.FAILED)
        .filter(r -> r.nextAttemptAt() != null && !r.nextAttemptAt().isAfter(now))
        .sorted(Comparator.comparing(LedgerRecord::nextAttemptAt))
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized List<LedgerRecord> findStaleClaims(Connection conn, RecordType type,
      Instant claimedBefore, int limit) {
    return byKey.values().stream()
        .filter(r -> r.ref().type() == type && r.status() == ExecutionStatus.CLAIMED)
        .filter(r -> r.claimedAt().isBefore(claimedBefore))
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized Optional<LedgerRecord> find(Connection conn, RecordRef ref) {
    return Optional.ofNullable(get(ref));
  }

  @Override
  public synchronized List<LedgerRecord> history(Connection conn, String tenantId, String subjectId, int limit) {
    return byKey.values().stream()
        .filter(r -> r.tenantId().equals(tenantId) && r.subjectId().equals(subjectId))
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized List<LedgerRecord> queryDead(Connection conn, RecordType type, int limit) {
    return byKey.values().stream()
        .filter(r -> r.ref().type() == type && r.status() == ExecutionStatus.DEAD)
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized int countDead(Connection conn, RecordType type) {
    return queryDead(conn, type, Integer.MAX_VALUE).size();
  }

  @Override
  public void appendMessageLog(Connection conn, MessageLogEntry entry) {
    messageLog.add(entry);
  }

  @Override
  public List<MessageLogEntry> messageLog(Connection conn, RecordRef ref) {
    return messageLog.stream().filter(e -> e.record().equals(ref)).toList();
  }

  private LedgerRecord get(RecordRef ref) {
    String key = keyById.get(ref.id());
    return key == null ? null : byKey.get(key);
  }

  private int transition(RecordRef ref, ExecutionStatus expected,
      UnaryOperator<LedgerRecord> change) {
    LedgerRecord current = get(ref);
    if (current == null || current.status() != expected) {
      return 0;
    }
    update(ref, change);
    return 1;
  }

  private void update(RecordRef ref, UnaryOperator<LedgerRecord> change) {
    String key = keyById.get(ref.id());
    byKey.put(key, change.apply(byKey.get(key)));
  }

  private static LedgerRecord copy(LedgerRecord r, ExecutionStatus status, int attempts, Instant claimedAt,
      Instant nextAttemptAt, Instant resolvedAt, String providerId, String lastError) {
    return new LedgerRecord(r.ref(), r.tenantId(), r.subjectId(), r.ruleId(), r.naturalKey(), r.action(),
        status, attempts, claimedAt, nextAttemptAt, resolvedAt, providerId, lastError);
  }
}
