package io.automation.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Enrollment of one subject into one campaign version.
 *
 * <p>{@code nextIndex} and {@code nextSendAt} only move forward once the delivery
 * for the current index is durably resolved.
 */
public record Subscription(
    String id,
    String tenantId,
    String campaignId,
    String lineageId,
    String subjectId,
    int nextIndex,
    Instant nextSendAt,
    Instant startedAt,
    Instant completedAt,
    Instant unsubscribedAt
) {

  public Subscription {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(lineageId, "lineageId");
    Objects.requireNonNull(subjectId, "subjectId");
    Objects.requireNonNull(nextSendAt, "nextSendAt");
    Objects.requireNonNull(startedAt, "startedAt");
  }

  public boolean isLive() {
    return completedAt == null && unsubscribedAt == null;
  }
}
