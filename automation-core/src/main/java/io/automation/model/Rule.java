package io.automation.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An automation definition owned by one tenant.
 *
 * <p>Candidates are only produced for lifecycle state entered at or after
 * {@code effectiveFrom}, so editing a rule never fires retroactively for
 * records that already settled.
 *
 * @param id            rule id
 * @param tenantId      owning tenant
 * @param name          display name
 * @param enabled       disabled rules never yield candidates
 * @param effectiveFrom earliest lifecycle time this rule reacts to
 * @param projectType   project type filter, or {@code null} for all types
 * @param spec          kind-specific payload
 */
public record Rule(
    String id,
    String tenantId,
    String name,
    boolean enabled,
    Instant effectiveFrom,
    String projectType,
    RuleSpec spec
) {

  public Rule {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(effectiveFrom, "effectiveFrom");
    Objects.requireNonNull(spec, "spec");
  }

  public RuleKind kind() {
    return spec.kind();
  }

  public boolean appliesToProjectType(String subjectProjectType) {
    return projectType == null || projectType.equals(subjectProjectType);
  }

  public boolean isEffectiveAt(Instant lifecycleTime) {
    return lifecycleTime != null && !lifecycleTime.isBefore(effectiveFrom);
  }
}
