package com.wakelink.command;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wakelink.message.MessageParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Исходящая команда устройству: тема и JSON-тело.
 * <p>
 * Запрос снимка и команда сна идут в тему {@code ESP32CAM/{id}/cmd},
 * запрос недостающих фрагментов: в {@code ESP32CAM/{id}/ack}.
 */
public class DeviceCommand {

  private final CommandKind kind;
  private final String deviceId;
  private final String topic;
  private final ObjectNode payload;

  private DeviceCommand(CommandKind kind, String deviceId, String topicSuffix, ObjectNode payload) {
    this.kind = kind;
    this.deviceId = deviceId;
    this.topic = MessageParser.TOPIC_PREFIX + "/" + deviceId + "/" + topicSuffix;
    this.payload = payload;
  }

  public static DeviceCommand captureRequest(String deviceId, String artifactName) {
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    payload.put("device_id", deviceId);
    payload.put("capture_image", true);
    payload.put("image_name", artifactName);
    return new DeviceCommand(CommandKind.CAPTURE_REQUEST, deviceId, "cmd", payload);
  }

  /**
   * Запрос повторной передачи. Индексы сортируются по возрастанию.
   */
  public static DeviceCommand missingFragments(String deviceId, String artifactName, List<Integer> indices) {
    List<Integer> sorted = new ArrayList<>(indices);
    Collections.sort(sorted);
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    payload.put("device_id", deviceId);
    payload.put("image_name", artifactName);
    ArrayNode missing = payload.putArray("missing_chunks");
    for (Integer index : sorted) {
      missing.add(index);
    }
    return new DeviceCommand(CommandKind.MISSING_FRAGMENTS, deviceId, "ack", payload);
  }

  /**
   * Команда сна до указанного времени вида "5:30PM".
   */
  public static DeviceCommand sleepUntil(String deviceId, String displayTime) {
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    payload.put("device_id", deviceId);
    payload.put("next_wake", displayTime);
    return new DeviceCommand(CommandKind.SLEEP_UNTIL, deviceId, "cmd", payload);
  }

  public CommandKind getKind() {
    return kind;
  }

  public String getDeviceId() {
    return deviceId;
  }

  public String getTopic() {
    return topic;
  }

  public ObjectNode getPayload() {
    return payload;
  }

  @Override
  public String toString() {
    return kind + " → " + topic + " " + payload;
  }
}
