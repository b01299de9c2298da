package io.automation.model;

/** Status of one transport attempt in the message log. */
public enum DeliveryStatus {
  SENT,
  FAILED
}
