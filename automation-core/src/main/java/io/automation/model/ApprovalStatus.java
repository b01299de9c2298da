package io.automation.model;

public enum ApprovalStatus {
  PENDING,
  APPROVED,
  REJECTED
}
