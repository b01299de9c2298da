package io.automation.spi;

import io.automation.model.Subscription;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for campaign subscriptions.
 *
 * <p>Storage enforces uniqueness per (subject, campaign version).
 */
public interface SubscriptionStore {

  /**
   * Inserts a subscription.
   *
   * @return {@code false} if a subscription for the same subject and campaign version exists
   */
  boolean insert(Connection conn, Subscription subscription);

  Optional<Subscription> find(Connection conn, String subscriptionId);

  /**
   * Returns live subscriptions with {@code nextSendAt <= now}, ordered by id, starting
   * after {@code afterId} ({@code null} for the first page).
   */
  List<Subscription> findDue(Connection conn, Instant now, String afterId, int limit);

  List<Subscription> findBySubject(Connection conn, String tenantId, String subjectId);

  /**
   * Returns {@code true} if the subject holds a subscription to any version of the lineage
   * that has not completed. Unsubscribed subscriptions count; completed ones do not.
   */
  boolean existsUncompletedInLineage(Connection conn, String subjectId, String lineageId);

  /**
   * Advances a live subscription if its {@code nextIndex} still equals {@code expectedIndex}.
   *
   * @return the number of rows updated (0 or 1)
   */
  int advance(Connection conn, String subscriptionId, int expectedIndex, int newIndex, Instant nextSendAt);

  /**
   * Sets {@code completedAt} on a live subscription.
   *
   * @return the number of rows updated (0 or 1)
   */
  int complete(Connection conn, String subscriptionId, Instant completedAt);

  /**
   * Sets {@code unsubscribedAt} on a live subscription.
   *
   * @return the number of rows updated (0 or 1)
   */
  int unsubscribe(Connection conn, String subscriptionId, Instant unsubscribedAt);
}
