package com.wakelink.model;

import java.time.Instant;

/**
 * Расписание устройства: последнее фактическое пробуждение и следующее расчётное.
 */
public class DeviceScheduleState {

  private final String deviceId;
  private final Instant lastWakeAt;
  private final Instant nextWakeAt;

  public DeviceScheduleState(String deviceId, Instant lastWakeAt, Instant nextWakeAt) {
    this.deviceId = deviceId;
    this.lastWakeAt = lastWakeAt;
    this.nextWakeAt = nextWakeAt;
  }

  public String getDeviceId() {
    return deviceId;
  }

  public Instant getLastWakeAt() {
    return lastWakeAt;
  }

  public Instant getNextWakeAt() {
    return nextWakeAt;
  }
}
