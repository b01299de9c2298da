package io.automation;

import io.automation.model.BusinessEventKind;
import io.automation.model.BusinessEventPayload;

import java.time.Instant;
import java.util.Objects;

/**
 * Input to the {@link io.automation.evaluate.TriggerEvaluator}.
 */
public sealed interface LifecycleEvent
    permits LifecycleEvent.StageEntered, LifecycleEvent.BusinessEventFired, LifecycleEvent.ClockTick {

  String tenantId();

  /** A subject entered stage {@code stageId} at {@code occurredAt}. */
  record StageEntered(String tenantId, String subjectId, String stageId, Instant occurredAt)
      implements LifecycleEvent {
    public StageEntered {
      Objects.requireNonNull(tenantId, "tenantId");
      Objects.requireNonNull(subjectId, "subjectId");
      Objects.requireNonNull(stageId, "stageId");
      Objects.requireNonNull(occurredAt, "occurredAt");
    }
  }

  /** A business event fired for a subject. */
  record BusinessEventFired(
      String tenantId,
      String subjectId,
      BusinessEventKind kind,
      BusinessEventPayload payload,
      Instant occurredAt
  ) implements LifecycleEvent {
    public BusinessEventFired {
      Objects.requireNonNull(tenantId, "tenantId");
      Objects.requireNonNull(subjectId, "subjectId");
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(occurredAt, "occurredAt");
      payload = payload == null ? BusinessEventPayload.EMPTY : payload;
    }
  }

  /**
   * A scheduler tick covering {@code [windowStart, windowEnd)} for one tenant.
   */
  record ClockTick(String tenantId, Instant windowStart, Instant windowEnd) implements LifecycleEvent {
    public ClockTick {
      Objects.requireNonNull(tenantId, "tenantId");
      Objects.requireNonNull(windowStart, "windowStart");
      Objects.requireNonNull(windowEnd, "windowEnd");
      if (windowEnd.isBefore(windowStart)) {
        throw new IllegalArgumentException("windowEnd must not be before windowStart");
      }
    }

    public boolean contains(Instant instant) {
      return !instant.isBefore(windowStart) && instant.isBefore(windowEnd);
    }
  }
}
