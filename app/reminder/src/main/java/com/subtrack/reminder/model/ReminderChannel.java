package com.subtrack.reminder.model;

public enum ReminderChannel {
  EMAIL,
  PUSH,
  IN_APP
}
