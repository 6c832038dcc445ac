package com.subtrack.reminder.model;

public record DeliveryReport(int claimed, int sent, int failed) {

  public static DeliveryReport empty() {
    return new DeliveryReport(0, 0, 0);
  }
}
