package io.automation.model;

/**
 * Attributes of a fired business event that binding constraints are checked against.
 *
 * @param amountCents monetary amount in minor units, or {@code null} when not applicable
 * @param subtype     record subtype (for example a project type), or {@code null}
 */
public record BusinessEventPayload(Long amountCents, String subtype) {

  public static final BusinessEventPayload EMPTY = new BusinessEventPayload(null, null);
}
