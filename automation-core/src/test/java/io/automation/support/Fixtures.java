package io.automation.support;

import io.automation.model.AnchorDatePrecondition;
import io.automation.model.ApprovalStatus;
import io.automation.model.Cadence;
import io.automation.model.Campaign;
import io.automation.model.CampaignContentItem;
import io.automation.model.CampaignStatus;
import io.automation.model.Channel;
import io.automation.model.QuietHours;
import io.automation.model.Rule;
import io.automation.model.RuleSpec;
import io.automation.model.Step;
import io.automation.model.Subject;
import io.automation.model.SubjectStatus;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Test data builders shared by the core tests.
 */
public final class Fixtures {
  public static final String TENANT = "studio-1";
  public static final Instant EPOCH = Instant.parse("2025-01-01T00:00:00Z");

  private Fixtures() {
  }

  public static Subject subject(String id, String stageId, Instant enteredAt) {
    return subject(id, stageId, enteredAt, null);
  }

  public static Subject subject(String id, String stageId, Instant enteredAt, LocalDate anchorDate) {
    return new Subject(id, TENANT, "wedding", stageId, enteredAt, anchorDate, SubjectStatus.ACTIVE,
        id + "@example.com", "+15550100", true, false);
  }

  public static Step step(String id, String ruleId, Duration delay, QuietHours quietHours) {
    return new Step(id, ruleId, 0, delay, "tpl-" + id, quietHours, true);
  }

  public static Rule communication(String id, String stageId, Step... steps) {
    return new Rule(id, TENANT, "welcome", true, EPOCH, null,
        new RuleSpec.Communication(stageId, Channel.EMAIL, AnchorDatePrecondition.ANY, List.of(steps)));
  }

  public static Rule nurture(String id, String lineageId) {
    return new Rule(id, TENANT, "nurture", true, EPOCH, null, new RuleSpec.Nurture(lineageId));
  }

  public static Campaign campaign(String id, String targetStageId, Cadence cadence) {
    return new Campaign(id, TENANT, id, "drip", targetStageId, null, CampaignStatus.ACTIVE, cadence,
        Duration.ofDays(365), Duration.ZERO, 1, null, true);
  }

  public static List<CampaignContentItem> approvedItems(String campaignId, int count) {
    List<CampaignContentItem> items = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      items.add(item(campaignId, i, ApprovalStatus.APPROVED));
    }
    return items;
  }

  public static CampaignContentItem item(String campaignId, int index, ApprovalStatus status) {
    return new CampaignContentItem(campaignId + "-item-" + index, campaignId, index,
        "Subject " + index, "Body " + index, "Body " + index, status, null, null);
  }
}
