package io.automation.model;

public enum RuleKind {
  COMMUNICATION,
  STAGE_CHANGE,
  COUNTDOWN,
  NURTURE
}
