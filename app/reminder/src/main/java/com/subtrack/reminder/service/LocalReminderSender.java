/*
 * Where: Reminder service layer
 * What: Channel that only logs the rendered reminder
 * Why: Exercise the ledger state machine without an external mail or push provider
 */
package com.subtrack.reminder.service;

import com.subtrack.reminder.model.ReminderRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalReminderSender implements ReminderSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalReminderSender.class);

  @Override
  public void send(ReminderRecord reminder) {
    logger.info(
        "reminder simulated send id={} subscriptionId={} userId={} channel={} subject=\"{}\""
            + " message=\"{}\"",
        reminder.reminderId(),
        reminder.subscriptionId(),
        reminder.userId(),
        reminder.channel(),
        reminder.subject(),
        reminder.message());
  }
}
