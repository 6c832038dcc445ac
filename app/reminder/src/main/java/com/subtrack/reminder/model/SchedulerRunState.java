/*
 * Where: Reminder domain model
 * What: States of a single scheduler run and their legal transitions
 * Why: A run moves strictly forward and can fail from any non-terminal state
 */
package com.subtrack.reminder.model;

public enum SchedulerRunState {
  LOADING,
  RECONCILING,
  DELIVERING,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }

  public boolean canTransitionTo(SchedulerRunState next) {
    if (isTerminal()) {
      return false;
    }
    if (next == FAILED) {
      return true;
    }
    return switch (this) {
      case LOADING -> next == RECONCILING;
      case RECONCILING -> next == DELIVERING;
      case DELIVERING -> next == DONE;
      case DONE, FAILED -> false;
    };
  }
}
