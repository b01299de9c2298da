package io.automation.model;

/** The two ledger tables: rule executions and campaign deliveries. */
public enum RecordType {
  EXECUTION,
  DELIVERY
}
