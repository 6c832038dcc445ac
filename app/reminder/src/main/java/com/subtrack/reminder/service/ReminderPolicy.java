/*
 * Where: Reminder service layer
 * What: Derives the reminders a subscription requires for its current due date
 * Why: Reconciliation compares this set against the ledger on every run
 */
package com.subtrack.reminder.service;

import com.subtrack.reminder.config.ReminderSchedulerProperties;
import com.subtrack.reminder.model.ReminderDraft;
import com.subtrack.reminder.model.ReminderKey;
import com.subtrack.reminder.model.SubscriptionRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Pure function of (subscription, today). Only the current {@code nextBillingDate} is considered;
 * reminders whose send instant already passed are still required and become deliverable at once.
 */
@Component
@RequiredArgsConstructor
public class ReminderPolicy {

  private static final DateTimeFormatter DUE_DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

  private final ReminderSchedulerProperties properties;
  private final Clock clock;

  public List<ReminderDraft> requiredReminders(SubscriptionRecord subscription, LocalDate today) {
    if (!subscription.active() || subscription.endedBy(today)) {
      return List.of();
    }
    final LocalDate dueDate = subscription.nextBillingDate();
    if (dueDate == null) {
      throw new InvalidSubscriptionException(
          subscription.subscriptionId(), "next billing date is missing");
    }
    if (subscription.endedBy(dueDate)) {
      return List.of();
    }
    if (subscription.startDate() != null && dueDate.isBefore(subscription.startDate())) {
      throw new InvalidSubscriptionException(
          subscription.subscriptionId(),
          "next billing date precedes start date nextBillingDate="
              + dueDate
              + " startDate="
              + subscription.startDate());
    }
    final List<Integer> leadDays =
        subscription.reminderLeadDays().stream().distinct().sorted().toList();
    final List<ReminderDraft> drafts = new ArrayList<>(leadDays.size());
    for (Integer lead : leadDays) {
      validateLead(subscription, lead);
      drafts.add(toDraft(subscription, dueDate, lead));
    }
    return drafts;
  }

  private void validateLead(SubscriptionRecord subscription, Integer lead) {
    if (lead == null || lead < 0 || lead > properties.maxLeadDays()) {
      throw new InvalidSubscriptionException(
          subscription.subscriptionId(),
          "reminder lead days must be within 0.."
              + properties.maxLeadDays()
              + " leadDays="
              + lead);
    }
  }

  private ReminderDraft toDraft(SubscriptionRecord subscription, LocalDate dueDate, int lead) {
    final LocalDate scheduledOn = dueDate.minusDays(lead);
    return new ReminderDraft(
        new ReminderKey(subscription.subscriptionId(), dueDate, lead),
        scheduledOn,
        sendInstant(scheduledOn),
        subscription.userId(),
        properties.channel(),
        renderSubject(subscription),
        renderMessage(subscription, dueDate, lead));
  }

  Instant sendInstant(LocalDate scheduledOn) {
    // atStartOfDay + offset moves forward across a DST gap instead of failing
    return scheduledOn
        .atStartOfDay(clock.getZone())
        .plus(properties.sendTimeOffset())
        .toInstant();
  }

  static String renderSubject(SubscriptionRecord subscription) {
    return subscription.name() + " subscription reminder";
  }

  static String renderMessage(SubscriptionRecord subscription, LocalDate dueDate, int lead) {
    return "Your "
        + subscription.name()
        + " subscription will be renewed "
        + renderLead(lead)
        + " on "
        + DUE_DATE_FORMAT.format(dueDate)
        + " for "
        + subscription.currency()
        + " "
        + String.format(Locale.ROOT, "%,.0f", subscription.amount())
        + ".";
  }

  private static String renderLead(int lead) {
    return switch (lead) {
      case 0 -> "today";
      case 1 -> "in 1 day";
      default -> "in " + lead + " days";
    };
  }
}
