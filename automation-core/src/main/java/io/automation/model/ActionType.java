package io.automation.model;

public enum ActionType {
  SEND_MESSAGE,
  CHANGE_STAGE,
  SEND_CAMPAIGN_MESSAGE,
  ENROLL_IN_CAMPAIGN
}
