package com.wakelink.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Утилитарный класс для загрузки конфигурации из application.properties.
 * <p>
 * Все параметры читаются из classpath-файла "application.properties".
 * Системные свойства JVM имеют приоритет над значениями из файла.
 */
public final class Config {

  private static final Properties PROPS = new Properties();

  static {
    try (InputStream input = Config.class.getClassLoader()
        .getResourceAsStream("application.properties")) {
      if (input == null) {
        throw new IllegalStateException("Файл application.properties не найден в classpath.");
      }
      PROPS.load(input);
    } catch (IOException e) {
      throw new IllegalStateException("Не удалось загрузить application.properties", e);
    }
  }

  /**
   * Возвращает значение обязательного параметра по ключу.
   * <p>
   * Если параметр отсутствует или пуст: бросает исключение.
   *
   * @param key Ключ параметра (например, "broker.bridge.url").
   * @return Непустое строковое значение.
   * @throws IllegalStateException если параметр не задан или пуст.
   */
  public static String getRequiredProperty(String key) {
    String value = lookup(key);
    if (value == null) {
      throw new IllegalStateException("Обязательный параметр '" + key + "' не задан ни в системных свойствах, ни в application.properties");
    }
    return value;
  }

  /**
   * Возвращает значение параметра или значение по умолчанию.
   */
  public static String getProperty(String key, String defaultValue) {
    String value = lookup(key);
    return value != null ? value : defaultValue;
  }

  public static int getInt(String key, int defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Параметр '" + key + "' должен быть целым числом, получено: " + value, e);
    }
  }

  public static Duration getMinutes(String key, long defaultMinutes) {
    return Duration.ofMinutes(getInt(key, (int) defaultMinutes));
  }

  public static Duration getSeconds(String key, long defaultSeconds) {
    return Duration.ofSeconds(getInt(key, (int) defaultSeconds));
  }

  private static String lookup(String key) {
    // Сначала пробуем системное свойство
    String sysValue = System.getProperty(key);
    if (sysValue != null && !sysValue.trim().isEmpty()) {
      return sysValue.trim();
    }
    // Иначе: из application.properties
    String propValue = PROPS.getProperty(key);
    if (propValue == null || propValue.trim().isEmpty()) {
      return null;
    }
    return propValue.trim();
  }

  // Запрещаем создание экземпляров
  private Config() {
    throw new UnsupportedOperationException("Utility class");
  }
}
