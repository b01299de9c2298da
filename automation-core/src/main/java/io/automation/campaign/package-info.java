/**
 * Drip campaigns: enrollment, per-tick progression and version publishing.
 *
 * @see io.automation.campaign.CampaignProgressor
 * @see io.automation.campaign.CampaignVersioner
 */
package io.automation.campaign;
