package com.wakelink.command;

/**
 * Виды команд устройству.
 */
public enum CommandKind {
  CAPTURE_REQUEST("capture_request"),
  MISSING_FRAGMENTS("missing_chunks"),
  SLEEP_UNTIL("sleep");

  private final String auditName;

  CommandKind(String auditName) {
    this.auditName = auditName;
  }

  /**
   * Название для журнала device_commands.
   */
  public String auditName() {
    return auditName;
  }
}
