package io.automation.dispatch;

import java.util.Objects;

/**
 * Result returned by {@link io.automation.spi.MessageTransport#send}.
 *
 * <ul>
 *   <li>{@link Sent}: the provider accepted the message.</li>
 *   <li>{@link Failed}: the provider rejected it; the classification decides between
 *       retry and DEAD.</li>
 * </ul>
 */
public sealed interface SendResult permits SendResult.Sent, SendResult.Failed {

  static Sent sent(String providerId) {
    return new Sent(providerId);
  }

  static Failed failed(FailureClassification classification, String reason) {
    return new Failed(classification, reason);
  }

  /**
   * @param providerId provider message id, may be {@code null} if the provider returns none
   */
  record Sent(String providerId) implements SendResult {
  }

  record Failed(FailureClassification classification, String reason) implements SendResult {
    public Failed {
      Objects.requireNonNull(classification, "classification");
    }
  }
}
