package io.automation;

import io.automation.model.ActionType;
import io.automation.model.Channel;

import java.util.Objects;

/**
 * The side effect a {@link Candidate} proposes.
 */
public sealed interface CandidateAction permits CandidateAction.SendMessage, CandidateAction.ChangeStage,
    CandidateAction.SendCampaignMessage, CandidateAction.EnrollInCampaign {

  ActionType type();

  /** Render a template and send it on a channel. */
  record SendMessage(Channel channel, String templateId) implements CandidateAction {
    public SendMessage {
      Objects.requireNonNull(channel, "channel");
      Objects.requireNonNull(templateId, "templateId");
    }

    @Override
    public ActionType type() {
      return ActionType.SEND_MESSAGE;
    }
  }

  /** Move the subject to another pipeline stage. */
  record ChangeStage(String targetStageId) implements CandidateAction {
    public ChangeStage {
      Objects.requireNonNull(targetStageId, "targetStageId");
    }

    @Override
    public ActionType type() {
      return ActionType.CHANGE_STAGE;
    }
  }

  /** Send the content item at {@code sequenceIndex} of a subscription's pinned campaign version. */
  record SendCampaignMessage(
      String campaignId,
      String subscriptionId,
      String contentItemId,
      int sequenceIndex
  ) implements CandidateAction {
    public SendCampaignMessage {
      Objects.requireNonNull(campaignId, "campaignId");
      Objects.requireNonNull(subscriptionId, "subscriptionId");
      Objects.requireNonNull(contentItemId, "contentItemId");
    }

    @Override
    public ActionType type() {
      return ActionType.SEND_CAMPAIGN_MESSAGE;
    }
  }

  /** Enroll the subject into the current version of a campaign lineage. */
  record EnrollInCampaign(String lineageId) implements CandidateAction {
    public EnrollInCampaign {
      Objects.requireNonNull(lineageId, "lineageId");
    }

    @Override
    public ActionType type() {
      return ActionType.ENROLL_IN_CAMPAIGN;
    }
  }
}
