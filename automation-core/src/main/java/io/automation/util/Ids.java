package io.automation.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Record id generation. Ids are monotonic ULIDs, so they sort by creation time.
 */
public final class Ids {

  private Ids() {
  }

  public static String newId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
