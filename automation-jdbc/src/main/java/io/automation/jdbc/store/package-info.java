/**
 * JDBC implementations of the subscription, rule and campaign stores.
 *
 * @see io.automation.jdbc.store.JdbcSubscriptionStore
 * @see io.automation.jdbc.store.JdbcRuleStore
 * @see io.automation.jdbc.store.JdbcCampaignStore
 */
package io.automation.jdbc.store;
