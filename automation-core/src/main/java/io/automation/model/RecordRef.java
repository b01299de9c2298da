package io.automation.model;

import java.util.Objects;

/** Identity of a ledger row. */
public record RecordRef(RecordType type, String id) {

  public RecordRef {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(id, "id");
  }

  @Override
  public String toString() {
    return type + ":" + id;
  }
}
