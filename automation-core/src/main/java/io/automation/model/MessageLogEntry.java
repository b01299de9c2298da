package io.automation.model;

import java.time.Instant;

/**
 * Audit row for one transport attempt, appended for successes and failures alike.
 */
public record MessageLogEntry(
    String id,
    String tenantId,
    String subjectId,
    RecordRef record,
    Channel channel,
    String recipient,
    DeliveryStatus status,
    String providerId,
    String error,
    Instant createdAt
) {}
