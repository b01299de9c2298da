package io.automation.dispatch;

import io.automation.model.Channel;

import java.util.Objects;

/**
 * A message ready for the transport.
 *
 * @param channel   outbound channel
 * @param recipient email address or phone number
 * @param subject   subject line, or {@code null} for SMS
 * @param body      message body
 */
public record RenderedMessage(Channel channel, String recipient, String subject, String body) {

  public RenderedMessage {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(recipient, "recipient");
    Objects.requireNonNull(body, "body");
  }
}
