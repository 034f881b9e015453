package com.wakelink.message;

/**
 * Вид входящего сообщения устройства.
 */
public enum MessageType {
  ALIVE,
  METADATA,
  FRAGMENT,
  TELEMETRY
}
