package com.wakelink.message;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Нормализация идентификатора устройства.
 * <p>
 * MAC-адрес приводится к 12 hex-символам в верхнем регистре без разделителей
 * ("98:a3:16:f8:29:28" → "98A316F82928"). Служебные идентификаторы с префиксами
 * TEST-, SYSTEM:, VIRTUAL: сохраняются как есть (в верхнем регистре).
 */
public final class DeviceIds {

  private static final Pattern SEPARATORS = Pattern.compile("[:\\-\\s]");
  private static final Pattern MAC = Pattern.compile("^[0-9A-Fa-f]{12}$");

  public static Optional<String> normalize(String identifier) {
    if (identifier == null || identifier.trim().isEmpty()) {
      return Optional.empty();
    }
    String upper = identifier.trim().toUpperCase(Locale.ROOT);
    if (upper.startsWith("TEST-") || upper.startsWith("SYSTEM:") || upper.startsWith("VIRTUAL:")) {
      return Optional.of(upper);
    }
    String cleaned = SEPARATORS.matcher(upper).replaceAll("");
    if (!MAC.matcher(cleaned).matches()) {
      return Optional.empty();
    }
    return Optional.of(cleaned);
  }

  private DeviceIds() {
    throw new UnsupportedOperationException("Utility class");
  }
}
