package io.automation.dispatch;

/**
 * Thrown when a message cannot be rendered (missing template, channel mismatch,
 * unreachable recipient). Always treated as a permanent failure.
 */
public class RenderException extends Exception {

  public RenderException(String message) {
    super(message);
  }

  public RenderException(String message, Throwable cause) {
    super(message, cause);
  }
}
