package io.automation.rules;

import io.automation.model.Campaign;
import io.automation.model.CampaignContentItem;
import io.automation.model.CampaignHistoryEntry;
import io.automation.model.Rule;
import io.automation.model.RuleKind;
import io.automation.spi.CampaignStore;
import io.automation.spi.RuleStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory {@link RuleStore}, for embedding and tests.
 *
 * <p>Also implements {@link CampaignStore} (ignoring the connection argument) so campaign
 * versions can be published against it.
 */
public final class InMemoryRuleStore implements RuleStore, CampaignStore {
  private final Map<String, Rule> rules = new ConcurrentHashMap<>();
  private final Map<String, Campaign> campaigns = new ConcurrentHashMap<>();
  private final Map<String, List<CampaignContentItem>> items = new ConcurrentHashMap<>();
  private final List<CampaignHistoryEntry> history = new CopyOnWriteArrayList<>();

  /**
   * Adds or replaces a rule (matched by id).
   *
   * @return this store
   */
  public InMemoryRuleStore putRule(Rule rule) {
    rules.put(rule.id(), rule);
    return this;
  }

  /**
   * Adds or replaces a campaign version and its content items.
   *
   * @return this store
   */
  public InMemoryRuleStore putCampaign(Campaign campaign, List<CampaignContentItem> contentItems) {
    campaigns.put(campaign.id(), campaign);
    items.put(campaign.id(), sorted(contentItems));
    return this;
  }

  /**
   * Replaces one content item, for example after approval.
   *
   * @return this store
   */
  public InMemoryRuleStore putContentItem(CampaignContentItem item) {
    items.compute(item.campaignId(), (id, existing) -> {
      List<CampaignContentItem> updated = new ArrayList<>();
      if (existing != null) {
        for (CampaignContentItem current : existing) {
          if (!current.id().equals(item.id())) {
            updated.add(current);
          }
        }
      }
      updated.add(item);
      return sorted(updated);
    });
    return this;
  }

  @Override
  public List<Rule> rules(String tenantId, RuleKind kind) {
    return rules.values().stream()
        .filter(r -> r.tenantId().equals(tenantId) && r.kind() == kind)
        .sorted(Comparator.comparing(Rule::id))
        .toList();
  }

  @Override
  public Optional<Campaign> campaign(String campaignId) {
    return Optional.ofNullable(campaigns.get(campaignId));
  }

  @Override
  public Optional<Campaign> currentCampaign(String tenantId, String lineageId) {
    return campaigns.values().stream()
        .filter(c -> c.tenantId().equals(tenantId) && c.lineageId().equals(lineageId) && c.currentVersion())
        .findFirst();
  }

  @Override
  public List<CampaignContentItem> contentItems(String campaignId) {
    return items.getOrDefault(campaignId, List.of());
  }

  @Override
  public List<String> tenantIds() {
    return rules.values().stream().map(Rule::tenantId).distinct().sorted().toList();
  }

  @Override
  public Optional<Campaign> find(Connection conn, String campaignId) {
    return campaign(campaignId);
  }

  @Override
  public List<CampaignContentItem> contentItems(Connection conn, String campaignId) {
    return contentItems(campaignId);
  }

  @Override
  public void insertVersion(Connection conn, Campaign campaign, List<CampaignContentItem> contentItems) {
    if (campaigns.putIfAbsent(campaign.id(), campaign) != null) {
      throw new IllegalStateException("Campaign version already exists: " + campaign.id());
    }
    items.put(campaign.id(), sorted(contentItems));
  }

  @Override
  public synchronized int retireVersion(Connection conn, String campaignId) {
    Campaign current = campaigns.get(campaignId);
    if (current == null || !current.currentVersion()) {
      return 0;
    }
    campaigns.put(campaignId, new Campaign(current.id(), current.tenantId(), current.lineageId(),
        current.name(), current.targetStageId(), current.projectType(), current.status(),
        current.cadence(), current.maxDuration(), current.initialDelay(), current.version(),
        current.parentVersionId(), false));
    return 1;
  }

  @Override
  public void appendHistory(Connection conn, CampaignHistoryEntry entry) {
    history.add(entry);
  }

  @Override
  public List<CampaignHistoryEntry> history(Connection conn, String lineageId) {
    return history.stream().filter(h -> h.lineageId().equals(lineageId)).toList();
  }

  private static List<CampaignContentItem> sorted(List<CampaignContentItem> contentItems) {
    return contentItems.stream()
        .sorted(Comparator.comparingInt(CampaignContentItem::sequenceIndex))
        .toList();
  }
}
