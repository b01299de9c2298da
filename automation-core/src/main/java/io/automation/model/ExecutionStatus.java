package io.automation.model;

/**
 * Status of an execution or delivery record.
 *
 * <p>CLAIMED is the only status a record is created with. FAILED records are
 * re-claimed for retry until the attempt ceiling, after which they become DEAD.
 */
public enum ExecutionStatus {
  CLAIMED(0),
  SUCCEEDED(1),
  FAILED(2),
  DEAD(3);

  private final int code;

  ExecutionStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static ExecutionStatus fromCode(int code) {
    for (ExecutionStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown execution status code: " + code);
  }
}
