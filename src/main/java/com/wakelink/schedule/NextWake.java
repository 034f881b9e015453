package com.wakelink.schedule;

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Следующее пробуждение: момент для БД и строка вида "6:30PM" для команды сна.
 */
public class NextWake {

  private final Instant instant;
  private final ZonedDateTime localTime;
  private final String displayTime;
  private final WakeSchedule schedule;

  public NextWake(Instant instant, ZonedDateTime localTime, String displayTime, WakeSchedule schedule) {
    this.instant = instant;
    this.localTime = localTime;
    this.displayTime = displayTime;
    this.schedule = schedule;
  }

  public Instant getInstant() {
    return instant;
  }

  public ZonedDateTime getLocalTime() {
    return localTime;
  }

  public String getDisplayTime() {
    return displayTime;
  }

  public WakeSchedule getSchedule() {
    return schedule;
  }

  @Override
  public String toString() {
    return displayTime + " (" + instant + ")";
  }
}
