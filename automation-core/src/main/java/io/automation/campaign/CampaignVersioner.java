package io.automation.campaign;

import io.automation.model.ApprovalStatus;
import io.automation.model.Campaign;
import io.automation.model.CampaignContentItem;
import io.automation.model.CampaignHistoryEntry;
import io.automation.spi.CampaignStore;
import io.automation.spi.ClockSource;
import io.automation.spi.ConnectionProvider;
import io.automation.util.Ids;
import io.automation.util.Transactions;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes edited campaign content as a new version.
 *
 * <p>The previous version keeps its content and loses its current flag; subscriptions
 * enrolled under it continue through its items. Every publish appends a history entry.
 */
public final class CampaignVersioner {
  private static final Logger logger = Logger.getLogger(CampaignVersioner.class.getName());

  private final ConnectionProvider connectionProvider;
  private final CampaignStore campaignStore;
  private final ClockSource clockSource;

  public CampaignVersioner(ConnectionProvider connectionProvider, CampaignStore campaignStore,
      ClockSource clockSource) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.campaignStore = Objects.requireNonNull(campaignStore, "campaignStore");
    this.clockSource = Objects.requireNonNull(clockSource, "clockSource");
  }

  /**
   * Edited content for one position of the new version.
   *
   * @param subject        subject line
   * @param body           edited body
   * @param originalBody   body as first generated, or {@code null} to use {@code body}
   * @param approvalStatus approval status of the edited item
   */
  public record ContentDraft(String subject, String body, String originalBody, ApprovalStatus approvalStatus) {
    public ContentDraft {
      Objects.requireNonNull(body, "body");
      approvalStatus = approvalStatus == null ? ApprovalStatus.PENDING : approvalStatus;
    }
  }

  /**
   * Publishes a new current version of a campaign.
   *
   * @param campaignId id of the version being edited; must be current
   * @param drafts     full content of the new version, in sequence order
   * @param editedBy   editor recorded on the items and in history
   * @param reason     free-text reason recorded in history
   * @return the new version
   * @throws IllegalArgumentException if the campaign does not exist
   * @throws IllegalStateException    if the campaign is not the current version
   * @throws SQLException             if the transaction fails
   */
  public Campaign publish(String campaignId, List<ContentDraft> drafts, String editedBy, String reason)
      throws SQLException {
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(drafts, "drafts");
    Instant now = clockSource.now();
    Campaign published = Transactions.inTransaction(connectionProvider, conn -> {
      Campaign current = campaignStore.find(conn, campaignId)
          .orElseThrow(() -> new IllegalArgumentException("Unknown campaign: " + campaignId));
      if (!current.currentVersion() || campaignStore.retireVersion(conn, campaignId) != 1) {
        throw new IllegalStateException("Campaign " + campaignId + " is not the current version");
      }
      Campaign next = current.nextVersion(Ids.newId());
      List<CampaignContentItem> previous = campaignStore.contentItems(conn, campaignId);
      List<CampaignContentItem> items = new ArrayList<>(drafts.size());
      for (int i = 0; i < drafts.size(); i++) {
        ContentDraft draft = drafts.get(i);
        String originalBody = draft.originalBody() != null ? draft.originalBody()
            : CampaignContentItem.atIndex(previous, i).map(CampaignContentItem::originalBody).orElse(draft.body());
        items.add(new CampaignContentItem(Ids.newId(), next.id(), i, draft.subject(), draft.body(),
            originalBody, draft.approvalStatus(), editedBy, now));
      }
      campaignStore.insertVersion(conn, next, items);
      campaignStore.appendHistory(conn, new CampaignHistoryEntry(Ids.newId(), current.lineageId(),
          next.id(), current.id(), next.version(), editedBy, reason, summarize(previous, items), now));
      return next;
    });
    logger.log(Level.INFO, "Published campaign {0} v{1} (parent {2})",
        new Object[] {published.id(), published.version(), campaignId});
    return published;
  }

  /**
   * Returns the publish history of a lineage, oldest first.
   */
  public List<CampaignHistoryEntry> history(String lineageId) throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> campaignStore.history(conn, lineageId));
  }

  static String summarize(List<CampaignContentItem> previous, List<CampaignContentItem> next) {
    List<Integer> changed = new ArrayList<>();
    int positions = Math.max(previous.size(), next.size());
    for (int i = 0; i < positions; i++) {
      Optional<CampaignContentItem> before = CampaignContentItem.atIndex(previous, i);
      Optional<CampaignContentItem> after = CampaignContentItem.atIndex(next, i);
      if (before.isEmpty() || after.isEmpty()
          || !Objects.equals(before.get().subject(), after.get().subject())
          || !Objects.equals(before.get().body(), after.get().body())) {
        changed.add(i);
      }
    }
    return previous.size() + " -> " + next.size() + " items; changed positions " + changed;
  }
}
