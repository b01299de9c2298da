package io.automation.model;

/**
 * Optional requirement on the subject's anchor date (for example an event date)
 * for a COMMUNICATION rule to apply.
 */
public enum AnchorDatePrecondition {
  ANY,
  REQUIRED,
  ABSENT;

  public boolean test(Subject subject) {
    return switch (this) {
      case ANY -> true;
      case REQUIRED -> subject.anchorDate() != null;
      case ABSENT -> subject.anchorDate() == null;
    };
  }
}
