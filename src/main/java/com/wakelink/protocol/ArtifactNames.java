package com.wakelink.protocol;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Генерация серверного имени снимка для пробуждения.
 */
public final class ArtifactNames {

  private static final DateTimeFormatter STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  /**
   * Например: "98A316F82928_20261018_123000.jpg".
   */
  public static String forWake(String deviceId, Instant wakeAt) {
    return deviceId + "_" + STAMP.format(wakeAt) + ".jpg";
  }

  private ArtifactNames() {
    throw new UnsupportedOperationException("Utility class");
  }
}
