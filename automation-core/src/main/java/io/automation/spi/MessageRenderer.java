package io.automation.spi;

import io.automation.dispatch.RenderException;
import io.automation.dispatch.RenderedMessage;
import io.automation.model.CampaignContentItem;
import io.automation.model.Channel;
import io.automation.model.Subject;

/**
 * Template rendering collaborator. Variable substitution happens outside the engine.
 *
 * <p>A {@link RenderException} is a permanent failure: the record goes DEAD without retries.
 */
public interface MessageRenderer {

  /**
   * Renders a rule template for a subject.
   *
   * @throws RenderException if the template is missing or does not match the channel
   */
  RenderedMessage render(Subject subject, Channel channel, String templateId) throws RenderException;

  /**
   * Renders a campaign content item for a subject. Campaigns are sent by email.
   */
  RenderedMessage renderCampaignItem(Subject subject, CampaignContentItem item) throws RenderException;
}
