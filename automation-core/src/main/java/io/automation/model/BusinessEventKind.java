package io.automation.model;

/** External business events that can move a subject between pipeline stages. */
public enum BusinessEventKind {
  DEPOSIT_PAID,
  FULL_PAYMENT_MADE,
  PROJECT_BOOKED,
  CONTRACT_SIGNED,
  ESTIMATE_ACCEPTED,
  EVENT_DATE_REACHED,
  PROJECT_DELIVERED,
  CLIENT_ONBOARDED,
  APPOINTMENT_BOOKED
}
