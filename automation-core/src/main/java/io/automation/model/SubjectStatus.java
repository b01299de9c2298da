package io.automation.model;

public enum SubjectStatus {
  ACTIVE,
  COMPLETED,
  ARCHIVED
}
