package com.wakelink.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Разбор сообщений устройства из пары (топик, JSON).
 * <p>
 * Топики: {@code ESP32CAM/{id}/status}: HELLO, {@code ESP32CAM/{id}/data}: метаданные,
 * фрагмент или чистая телеметрия. Поддерживаются варианты имён полей из разных версий прошивки.
 */
public class MessageParser {

  public static final String TOPIC_PREFIX = "ESP32CAM";

  private final Clock clock;

  public MessageParser(Clock clock) {
    this.clock = clock;
  }

  /**
   * Разбирает сообщение.
   *
   * @param topic Топик MQTT.
   * @param payload Тело сообщения.
   * @return Типизированное сообщение.
   * @throws MalformedMessageException если сообщение нельзя интерпретировать.
   */
  public InboundMessage parse(String topic, JsonNode payload) throws MalformedMessageException {
    if (topic == null) {
      throw new MalformedMessageException("Не указан топик");
    }
    if (payload == null || !payload.isObject()) {
      throw new MalformedMessageException("Тело сообщения не является JSON-объектом, топик " + topic);
    }

    String[] parts = topic.split("/");
    if (parts.length != 3 || !TOPIC_PREFIX.equals(parts[0])) {
      throw new MalformedMessageException("Неизвестный топик: " + topic);
    }
    String deviceId = DeviceIds.normalize(parts[1])
        .orElseThrow(() -> new MalformedMessageException("Некорректный идентификатор устройства: " + parts[1]));

    switch (parts[2]) {
      case "status":
        return parseAlive(deviceId, payload);
      case "data":
        return parseData(deviceId, payload);
      default:
        throw new MalformedMessageException("Неизвестный тип топика: " + topic);
    }
  }

  private AliveMessage parseAlive(String deviceId, JsonNode payload) throws MalformedMessageException {
    String status = optionalText(payload, "status");
    if (status != null && !"alive".equalsIgnoreCase(status)) {
      throw new MalformedMessageException("Неожиданный статус устройства: " + status);
    }
    Integer pending = optionalInt(payload, "pendingImg", "pending_count");
    if (pending != null && pending < 0) {
      throw new MalformedMessageException("Отрицательный pendingImg: " + pending);
    }
    return new AliveMessage(
        deviceId,
        pending != null ? pending : 0,
        optionalText(payload, "firmware_version"),
        optionalText(payload, "hardware_version"),
        optionalDouble(payload, "battery_voltage"),
        optionalInt(payload, "wifi_rssi"));
  }

  private InboundMessage parseData(String deviceId, JsonNode payload) throws MalformedMessageException {
    boolean hasImageName = payload.hasNonNull("image_name");
    boolean hasChunkId = payload.hasNonNull("chunk_id");
    SensorReadings readings = parseReadings(payload);

    if (!hasImageName && !hasChunkId) {
      if (readings.isEmpty()) {
        throw new MalformedMessageException("Сообщение data без image_name, chunk_id и показаний датчиков");
      }
      return new TelemetryMessage(
          deviceId,
          parseTimestamp(payload, "captured_at", "timestamp"),
          readings,
          optionalDouble(payload, "battery_voltage"),
          optionalInt(payload, "wifi_rssi"));
    }

    String artifactName = requiredText(payload, "image_name");
    if (hasChunkId) {
      int index = optionalInt(payload, "chunk_id");
      if (index < 0) {
        throw new MalformedMessageException("Отрицательный chunk_id: " + index);
      }
      return new FragmentMessage(deviceId, artifactName, index, parseFragmentBytes(payload.get("payload")));
    }

    Integer total = optionalInt(payload, "total_chunks_count", "total_chunk_count");
    if (total == null || total <= 0) {
      throw new MalformedMessageException("Метаданные снимка " + artifactName + " без корректного числа фрагментов");
    }
    return new MetadataMessage(
        deviceId,
        artifactName,
        total,
        optionalInt(payload, "image_size"),
        optionalInt(payload, "max_chunk_size", "max_chunks_size"),
        parseTimestamp(payload, "capture_timestamp", "timestamp", "capture_timeStamp"),
        readings,
        optionalInt(payload, "error"));
  }

  private SensorReadings parseReadings(JsonNode payload) throws MalformedMessageException {
    JsonNode nested = payload.get("sensor_data");
    JsonNode source = nested != null && nested.isObject() ? nested : payload;
    SensorReadings readings = new SensorReadings(
        optionalDouble(source, "temperature"),
        optionalDouble(source, "humidity"),
        optionalDouble(source, "pressure"),
        optionalDouble(source, "gas_resistance"));
    if (readings.isEmpty() && source != payload) {
      // вложенный объект пуст, пробуем плоские поля
      return new SensorReadings(
          optionalDouble(payload, "temperature"),
          optionalDouble(payload, "humidity"),
          optionalDouble(payload, "pressure"),
          optionalDouble(payload, "gas_resistance"));
    }
    return readings;
  }

  private byte[] parseFragmentBytes(JsonNode node) throws MalformedMessageException {
    byte[] bytes;
    if (node == null || node.isNull()) {
      throw new MalformedMessageException("Фрагмент без payload");
    } else if (node.isTextual()) {
      try {
        bytes = Base64.getDecoder().decode(node.asText());
      } catch (IllegalArgumentException e) {
        throw new MalformedMessageException("payload фрагмента не является base64", e);
      }
    } else if (node.isArray()) {
      ArrayNode array = (ArrayNode) node;
      bytes = new byte[array.size()];
      for (int i = 0; i < array.size(); i++) {
        JsonNode element = array.get(i);
        if (!element.canConvertToInt() || element.asInt() < -128 || element.asInt() > 255) {
          throw new MalformedMessageException("Недопустимое значение байта в payload на позиции " + i);
        }
        bytes[i] = (byte) element.asInt();
      }
    } else {
      throw new MalformedMessageException("Неподдерживаемый формат payload: " + node.getNodeType());
    }
    if (bytes.length == 0) {
      throw new MalformedMessageException("Пустой payload фрагмента");
    }
    return bytes;
  }

  private Instant parseTimestamp(JsonNode payload, String... names) throws MalformedMessageException {
    String value = optionalText(payload, names);
    if (value == null) {
      return clock.instant();
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new MalformedMessageException("Некорректная метка времени: " + value, e);
    }
  }

  private static String requiredText(JsonNode payload, String name) throws MalformedMessageException {
    String value = optionalText(payload, name);
    if (value == null || value.isEmpty()) {
      throw new MalformedMessageException("Отсутствует обязательное поле " + name);
    }
    return value;
  }

  private static String optionalText(JsonNode payload, String... names) {
    for (String name : names) {
      JsonNode node = payload.get(name);
      if (node != null && !node.isNull()) {
        return node.asText();
      }
    }
    return null;
  }

  private static Integer optionalInt(JsonNode payload, String... names) throws MalformedMessageException {
    for (String name : names) {
      JsonNode node = payload.get(name);
      if (node != null && !node.isNull()) {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
          throw new MalformedMessageException("Поле " + name + " должно быть целым числом");
        }
        return node.intValue();
      }
    }
    return null;
  }

  private static Double optionalDouble(JsonNode payload, String name) throws MalformedMessageException {
    JsonNode node = payload.get(name);
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isNumber()) {
      throw new MalformedMessageException("Поле " + name + " должно быть числом");
    }
    return node.doubleValue();
  }
}
