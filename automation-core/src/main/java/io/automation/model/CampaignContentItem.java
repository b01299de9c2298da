package io.automation.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One message of a campaign sequence. Only APPROVED items are dispatched.
 *
 * @param id             item id
 * @param campaignId     owning campaign version
 * @param sequenceIndex  0-based position in the sequence
 * @param subject        message subject line
 * @param body           current body
 * @param originalBody   body as first generated, kept for edit provenance
 * @param approvalStatus approval state
 * @param editedBy       last editor, or {@code null}
 * @param editedAt       last edit time, or {@code null}
 */
public record CampaignContentItem(
    String id,
    String campaignId,
    int sequenceIndex,
    String subject,
    String body,
    String originalBody,
    ApprovalStatus approvalStatus,
    String editedBy,
    Instant editedAt
) {

  public CampaignContentItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(approvalStatus, "approvalStatus");
    if (sequenceIndex < 0) {
      throw new IllegalArgumentException("sequenceIndex must be >= 0");
    }
  }

  public boolean isApproved() {
    return approvalStatus == ApprovalStatus.APPROVED;
  }

  public static Optional<CampaignContentItem> atIndex(List<CampaignContentItem> items, int index) {
    for (CampaignContentItem item : items) {
      if (item.sequenceIndex() == index) {
        return Optional.of(item);
      }
    }
    return Optional.empty();
  }
}
