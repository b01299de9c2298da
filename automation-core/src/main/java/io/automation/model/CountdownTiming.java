package io.automation.model;

public enum CountdownTiming {
  BEFORE,
  AFTER
}
