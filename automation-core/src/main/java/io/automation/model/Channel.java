package io.automation.model;

/** Outbound message channel. */
public enum Channel {
  EMAIL,
  SMS
}
