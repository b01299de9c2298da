package io.automation.support;

import io.automation.dispatch.RenderException;
import io.automation.dispatch.RenderedMessage;
import io.automation.model.CampaignContentItem;
import io.automation.model.Channel;
import io.automation.model.Subject;
import io.automation.spi.MessageRenderer;

/**
 * Renders the template id (or campaign item body) verbatim. Template ids starting with
 * {@code broken} fail to render.
 */
public final class StubRenderer implements MessageRenderer {

  @Override
  public RenderedMessage render(Subject subject, Channel channel, String templateId) throws RenderException {
    if (templateId.startsWith("broken")) {
      throw new RenderException("unknown template " + templateId);
    }
    return new RenderedMessage(channel, subject.recipient(channel), templateId, "body of " + templateId);
  }

  @Override
  public RenderedMessage renderCampaignItem(Subject subject, CampaignContentItem item) {
    return new RenderedMessage(Channel.EMAIL, subject.email(), item.subject(), item.body());
  }
}
