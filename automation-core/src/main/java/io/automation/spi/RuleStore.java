package io.automation.spi;

import io.automation.model.Campaign;
import io.automation.model.CampaignContentItem;
import io.automation.model.Rule;
import io.automation.model.RuleKind;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view over automation definitions authored by an external editor.
 *
 * <p>Returns disabled rules too; the evaluator filters on {@link Rule#enabled()}.
 *
 * @see io.automation.rules.InMemoryRuleStore
 */
public interface RuleStore {

  /**
   * Returns every rule of the given kind owned by the tenant.
   */
  List<Rule> rules(String tenantId, RuleKind kind);

  /**
   * Returns a campaign version by id, current or not.
   */
  Optional<Campaign> campaign(String campaignId);

  /**
   * Returns the version of a campaign lineage that new enrollments bind to.
   */
  Optional<Campaign> currentCampaign(String tenantId, String lineageId);

  /**
   * Returns the content items of a campaign version ordered by sequence index.
   */
  List<CampaignContentItem> contentItems(String campaignId);

  /**
   * Returns the tenants that own at least one rule; clock ticks are evaluated per tenant.
   */
  List<String> tenantIds();
}
