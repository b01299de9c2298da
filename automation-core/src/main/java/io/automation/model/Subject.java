package io.automation.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Snapshot of a subject record (a project and its client contact) owned by the
 * external record store.
 *
 * @param id             subject record id
 * @param tenantId       owning tenant
 * @param projectType    project type used by rule filters
 * @param stageId        current pipeline stage, or {@code null}
 * @param stageEnteredAt when the subject entered its current stage
 * @param anchorDate     the subject's anchor date (for example the event date), or {@code null}
 * @param status         lifecycle status; only ACTIVE subjects produce candidates
 * @param email          contact email address, or {@code null}
 * @param phone          contact phone number, or {@code null}
 * @param emailOptIn     consent to receive email
 * @param smsOptIn       consent to receive SMS
 */
public record Subject(
    String id,
    String tenantId,
    String projectType,
    String stageId,
    Instant stageEnteredAt,
    LocalDate anchorDate,
    SubjectStatus status,
    String email,
    String phone,
    boolean emailOptIn,
    boolean smsOptIn
) {

  public Subject {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tenantId, "tenantId");
    status = status == null ? SubjectStatus.ACTIVE : status;
  }

  public boolean isActive() {
    return status == SubjectStatus.ACTIVE;
  }

  /** Returns {@code true} if the subject consented to and can be reached on the channel. */
  public boolean isReachable(Channel channel) {
    return switch (channel) {
      case EMAIL -> emailOptIn && email != null && !email.isBlank();
      case SMS -> smsOptIn && phone != null && !phone.isBlank();
    };
  }

  public String recipient(Channel channel) {
    return channel == Channel.EMAIL ? email : phone;
  }

  public Subject inStage(String newStageId, Instant enteredAt) {
    return new Subject(id, tenantId, projectType, newStageId, enteredAt, anchorDate, status,
        email, phone, emailOptIn, smsOptIn);
  }
}
