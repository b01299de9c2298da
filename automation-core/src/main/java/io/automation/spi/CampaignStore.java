package io.automation.spi;

import io.automation.model.Campaign;
import io.automation.model.CampaignContentItem;
import io.automation.model.CampaignHistoryEntry;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Write side of campaign versioning. Existing versions and their content are never
 * modified apart from clearing the current-version flag.
 *
 * @see io.automation.campaign.CampaignVersioner
 */
public interface CampaignStore {

  Optional<Campaign> find(Connection conn, String campaignId);

  List<CampaignContentItem> contentItems(Connection conn, String campaignId);

  /**
   * Inserts a new campaign version with its content items.
   */
  void insertVersion(Connection conn, Campaign campaign, List<CampaignContentItem> items);

  /**
   * Clears the current-version flag of a version that is still current.
   *
   * @return the number of rows updated (0 if another publish already retired it)
   */
  int retireVersion(Connection conn, String campaignId);

  void appendHistory(Connection conn, CampaignHistoryEntry entry);

  /**
   * Returns the history of a lineage, oldest first.
   */
  List<CampaignHistoryEntry> history(Connection conn, String lineageId);
}
