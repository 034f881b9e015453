package com.wakelink.message;

/**
 * HELLO: устройство проснулось и сообщает число неотправленных снимков.
 */
public class AliveMessage extends InboundMessage {

  private static final double MIN_VOLTAGE = 3.0;
  private static final double MAX_VOLTAGE = 4.2;

  private final int pendingCount;
  private final String firmwareVersion;
  private final String hardwareVersion;
  private final Double batteryVoltage;
  private final Integer wifiRssi;

  public AliveMessage(String deviceId, int pendingCount, String firmwareVersion, String hardwareVersion,
                      Double batteryVoltage, Integer wifiRssi) {
    super(deviceId);
    this.pendingCount = pendingCount;
    this.firmwareVersion = firmwareVersion;
    this.hardwareVersion = hardwareVersion;
    this.batteryVoltage = batteryVoltage;
    this.wifiRssi = wifiRssi;
  }

  @Override
  public MessageType getType() {
    return MessageType.ALIVE;
  }

  public int getPendingCount() {
    return pendingCount;
  }

  public String getFirmwareVersion() {
    return firmwareVersion;
  }

  public String getHardwareVersion() {
    return hardwareVersion;
  }

  public Double getBatteryVoltage() {
    return batteryVoltage;
  }

  public Integer getWifiRssi() {
    return wifiRssi;
  }

  /**
   * Заряд батареи в процентах: 3.0 В = 0 %, 4.2 В = 100 %, с ограничением диапазона.
   *
   * @return Процент или null, если напряжение не передано.
   */
  public Integer getBatteryHealthPercent() {
    if (batteryVoltage == null) {
      return null;
    }
    double percent = (batteryVoltage - MIN_VOLTAGE) / (MAX_VOLTAGE - MIN_VOLTAGE) * 100;
    return (int) Math.round(Math.max(0, Math.min(100, percent)));
  }
}
