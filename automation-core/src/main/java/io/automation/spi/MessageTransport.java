package io.automation.spi;

import io.automation.dispatch.RenderedMessage;
import io.automation.dispatch.SendResult;

/**
 * Outbound message transport (email or SMS provider).
 *
 * <p>The dispatcher calls it with a bounded timeout; an exception or timeout counts
 * as a transient failure.
 */
@FunctionalInterface
public interface MessageTransport {

  SendResult send(RenderedMessage message) throws Exception;
}
