package io.automation.model;

import java.time.Duration;
import java.util.Objects;

/**
 * One version of a drip campaign.
 *
 * <p>Editing content publishes a new row with {@code parentVersionId} pointing at the
 * previous one. All versions of a campaign share a {@code lineageId} (the id of the
 * first version). Live subscriptions stay pinned to the version they enrolled under.
 *
 * @param id              version id
 * @param tenantId        owning tenant
 * @param lineageId       id shared by every version of this campaign
 * @param name            display name
 * @param targetStageId   stage whose entry enrolls subjects
 * @param projectType     project type filter, or {@code null} for all
 * @param status          campaign status
 * @param cadence         interval between sends
 * @param maxDuration     subscriptions older than this are completed
 * @param initialDelay    delay before the first item is due
 * @param version         1-based version number within the lineage
 * @param parentVersionId previous version id, or {@code null} for the first version
 * @param currentVersion  whether new enrollments bind to this version
 */
public record Campaign(
    String id,
    String tenantId,
    String lineageId,
    String name,
    String targetStageId,
    String projectType,
    CampaignStatus status,
    Cadence cadence,
    Duration maxDuration,
    Duration initialDelay,
    int version,
    String parentVersionId,
    boolean currentVersion
) {

  public Campaign {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(lineageId, "lineageId");
    Objects.requireNonNull(targetStageId, "targetStageId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(cadence, "cadence");
    Objects.requireNonNull(maxDuration, "maxDuration");
    initialDelay = initialDelay == null ? Duration.ZERO : initialDelay;
    if (maxDuration.isNegative() || maxDuration.isZero()) {
      throw new IllegalArgumentException("maxDuration must be positive");
    }
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0");
    }
    if (version < 1) {
      throw new IllegalArgumentException("version must be >= 1");
    }
  }

  public boolean appliesToProjectType(String subjectProjectType) {
    return projectType == null || projectType.equals(subjectProjectType);
  }

  /** Returns the next version of this campaign, marked current. */
  public Campaign nextVersion(String newId) {
    return new Campaign(newId, tenantId, lineageId, name, targetStageId, projectType, status,
        cadence, maxDuration, initialDelay, version + 1, id, true);
  }
}
