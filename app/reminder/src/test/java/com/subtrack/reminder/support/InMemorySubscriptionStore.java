package com.subtrack.reminder.support;

import com.subtrack.reminder.model.SubscriptionRecord;
import com.subtrack.reminder.repository.SubscriptionStore;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import org.springframework.dao.DataAccessResourceFailureException;

public class InMemorySubscriptionStore implements SubscriptionStore {

  private final Map<UUID, SubscriptionRecord> subscriptions = new LinkedHashMap<>();
  private boolean unavailable;
  private Consumer<UUID> beforeConditionalWrite = id -> {};
  private Consumer<List<SubscriptionRecord>> afterListing = listed -> {};

  public synchronized void failReads(boolean unavailable) {
    this.unavailable = unavailable;
  }

  /** Runs before each conditional write, outside the monitor, to simulate a competing writer. */
  public synchronized void beforeConditionalWrite(Consumer<UUID> hook) {
    this.beforeConditionalWrite = hook;
  }

  /** Runs after each due listing is taken, outside the monitor, so the snapshot can go stale. */
  public synchronized void afterListing(Consumer<List<SubscriptionRecord>> hook) {
    this.afterListing = hook;
  }

  public synchronized boolean isCurrentDueDate(UUID subscriptionId, LocalDate dueDate) {
    final SubscriptionRecord current = subscriptions.get(subscriptionId);
    return current != null && current.active() && current.nextBillingDate().equals(dueDate);
  }

  public synchronized SubscriptionRecord get(UUID subscriptionId) {
    return subscriptions.get(subscriptionId);
  }

  public synchronized void put(SubscriptionRecord record) {
    subscriptions.put(record.subscriptionId(), record);
  }

  @Override
  public synchronized void insert(SubscriptionRecord record) {
    subscriptions.put(record.subscriptionId(), record);
  }

  @Override
  public synchronized Optional<SubscriptionRecord> findById(UUID subscriptionId) {
    return Optional.ofNullable(subscriptions.get(subscriptionId));
  }

  @Override
  public List<SubscriptionRecord> listDueWithin(LocalDate from, LocalDate to) {
    final List<SubscriptionRecord> listed;
    final Consumer<List<SubscriptionRecord>> hook;
    synchronized (this) {
      if (unavailable) {
        throw new DataAccessResourceFailureException("subscription store unavailable");
      }
      listed =
          subscriptions.values().stream()
              .filter(SubscriptionRecord::active)
              .filter(s -> !s.nextBillingDate().isBefore(from) && !s.nextBillingDate().isAfter(to))
              .sorted(Comparator.comparing(SubscriptionRecord::nextBillingDate))
              .toList();
      hook = afterListing;
    }
    hook.accept(listed);
    return listed;
  }

  @Override
  public synchronized List<SubscriptionRecord> listLapsedAutoRenew(LocalDate today) {
    return subscriptions.values().stream()
        .filter(s -> s.active() && s.autoRenew() && s.nextBillingDate().isBefore(today))
        .toList();
  }

  @Override
  public boolean updateNextBillingDate(
      UUID subscriptionId, LocalDate expectedOldDate, LocalDate newDate) {
    hook().accept(subscriptionId);
    synchronized (this) {
      final SubscriptionRecord current = subscriptions.get(subscriptionId);
      if (current == null
          || !current.active()
          || !current.nextBillingDate().equals(expectedOldDate)) {
        return false;
      }
      subscriptions.put(subscriptionId, current.withNextBillingDate(newDate));
      return true;
    }
  }

  @Override
  public boolean deactivate(UUID subscriptionId) {
    hook().accept(subscriptionId);
    synchronized (this) {
      final SubscriptionRecord current = subscriptions.get(subscriptionId);
      if (current == null || !current.active()) {
        return false;
      }
      subscriptions.put(subscriptionId, current.deactivated());
      return true;
    }
  }

  private synchronized Consumer<UUID> hook() {
    return beforeConditionalWrite;
  }
}
