package io.automation.dispatch;

import java.time.Instant;

/**
 * Notified after a stage transition has been committed, so automations bound to the
 * target stage run without waiting for the next tick.
 */
@FunctionalInterface
public interface StageTransitionListener {

  StageTransitionListener NONE = (tenantId, subjectId, stageId, enteredAt) -> {
  };

  void onStageEntered(String tenantId, String subjectId, String stageId, Instant enteredAt);
}
