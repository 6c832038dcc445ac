/*
 * Where: Reminder repository layer
 * What: Collaborator operations the engine needs on subscriptions
 * Why: Keeps the scheduler and advancer independent of the subscription persistence details
 */
package com.subtrack.reminder.repository;

import com.subtrack.reminder.model.SubscriptionRecord;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionStore {

  /** Registers a subscription. Used by the CRUD collaborator and by fixtures. */
  void insert(SubscriptionRecord record);

  Optional<SubscriptionRecord> findById(UUID subscriptionId);

  /** Active subscriptions whose next billing date lies within [from, to], both inclusive. */
  List<SubscriptionRecord> listDueWithin(LocalDate from, LocalDate to);

  /** Active auto-renew subscriptions whose next billing date is strictly before {@code today}. */
  List<SubscriptionRecord> listLapsedAutoRenew(LocalDate today);

  /**
   * Moves the next billing date only if it still equals {@code expectedOldDate}.
   *
   * @return false when another writer advanced or deactivated the subscription first
   */
  boolean updateNextBillingDate(UUID subscriptionId, LocalDate expectedOldDate, LocalDate newDate);

  /** @return false when the subscription was already inactive or does not exist */
  boolean deactivate(UUID subscriptionId);
}
