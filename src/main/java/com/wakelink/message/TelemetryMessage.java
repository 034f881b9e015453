package com.wakelink.message;

import java.time.Instant;

/**
 * Только телеметрия, без снимка.
 */
public class TelemetryMessage extends InboundMessage {

  private final Instant capturedAt;
  private final SensorReadings readings;
  private final Double batteryVoltage;
  private final Integer wifiRssi;

  public TelemetryMessage(String deviceId, Instant capturedAt, SensorReadings readings,
                          Double batteryVoltage, Integer wifiRssi) {
    super(deviceId);
    this.capturedAt = capturedAt;
    this.readings = readings;
    this.batteryVoltage = batteryVoltage;
    this.wifiRssi = wifiRssi;
  }

  @Override
  public MessageType getType() {
    return MessageType.TELEMETRY;
  }

  public Instant getCapturedAt() {
    return capturedAt;
  }

  public SensorReadings getReadings() {
    return readings;
  }

  public Double getBatteryVoltage() {
    return batteryVoltage;
  }

  public Integer getWifiRssi() {
    return wifiRssi;
  }
}
