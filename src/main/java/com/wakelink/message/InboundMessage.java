package com.wakelink.message;

/**
 * Базовый класс входящего сообщения. Идентификатор устройства уже нормализован.
 */
public abstract class InboundMessage {

  private final String deviceId;

  protected InboundMessage(String deviceId) {
    this.deviceId = deviceId;
  }

  public String getDeviceId() {
    return deviceId;
  }

  public abstract MessageType getType();
}
