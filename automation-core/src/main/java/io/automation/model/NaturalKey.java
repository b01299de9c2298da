package io.automation.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Domain tuple that identifies one executed action. The storage layer enforces
 * uniqueness of {@link #value()}; delivery keys are additionally unique on their
 * (subscription, content item) columns.
 */
public sealed interface NaturalKey permits NaturalKey.Communication, NaturalKey.StageChange,
    NaturalKey.Countdown, NaturalKey.Delivery, NaturalKey.Enrollment {

  /** Canonical string form, stable across processes. */
  String value();

  record Communication(String subjectId, String stepId) implements NaturalKey {
    public Communication {
      Objects.requireNonNull(subjectId, "subjectId");
      Objects.requireNonNull(stepId, "stepId");
    }

    @Override
    public String value() {
      return "communication:" + subjectId + ":" + stepId;
    }
  }

  record StageChange(String subjectId, String ruleId, BusinessEventKind eventKind) implements NaturalKey {
    public StageChange {
      Objects.requireNonNull(subjectId, "subjectId");
      Objects.requireNonNull(ruleId, "ruleId");
      Objects.requireNonNull(eventKind, "eventKind");
    }

    @Override
    public String value() {
      return "stage-change:" + subjectId + ":" + ruleId + ":" + eventKind;
    }
  }

  record Countdown(String subjectId, String ruleId, LocalDate anchorDate, int offsetDays) implements NaturalKey {
    public Countdown {
      Objects.requireNonNull(subjectId, "subjectId");
      Objects.requireNonNull(ruleId, "ruleId");
      Objects.requireNonNull(anchorDate, "anchorDate");
    }

    @Override
    public String value() {
      return "countdown:" + subjectId + ":" + ruleId + ":" + anchorDate + ":" + offsetDays;
    }
  }

  record Delivery(String subscriptionId, String contentItemId) implements NaturalKey {
    public Delivery {
      Objects.requireNonNull(subscriptionId, "subscriptionId");
      Objects.requireNonNull(contentItemId, "contentItemId");
    }

    @Override
    public String value() {
      return "delivery:" + subscriptionId + ":" + contentItemId;
    }
  }

  /** Enrollment is committed by the subscription insert, not by a ledger row. */
  record Enrollment(String subjectId, String lineageId) implements NaturalKey {
    public Enrollment {
      Objects.requireNonNull(subjectId, "subjectId");
      Objects.requireNonNull(lineageId, "lineageId");
    }

    @Override
    public String value() {
      return "enrollment:" + subjectId + ":" + lineageId;
    }
  }
}
