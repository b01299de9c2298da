package io.automation.model;

import java.time.Instant;

/**
 * Append-only audit entry written when a campaign version is published.
 */
public record CampaignHistoryEntry(
    String id,
    String lineageId,
    String campaignId,
    String parentCampaignId,
    int version,
    String editedBy,
    String reason,
    String summary,
    Instant changedAt
) {}
