package io.automation.model;

/**
 * Campaign lifecycle. Only ACTIVE campaigns enroll new subjects; PAUSED campaigns
 * hold all subscriptions without advancing them.
 */
public enum CampaignStatus {
  DRAFT,
  APPROVED,
  ACTIVE,
  PAUSED
}
