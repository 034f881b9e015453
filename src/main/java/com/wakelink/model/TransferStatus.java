package com.wakelink.model;

import java.util.Locale;

/**
 * Статус сборки снимка.
 */
public enum TransferStatus {
  RECEIVING,
  COMPLETE,
  FAILED;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static TransferStatus fromDbValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
