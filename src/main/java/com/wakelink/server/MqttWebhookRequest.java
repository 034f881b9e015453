package com.wakelink.server;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Тело вебхука от моста MQTT: {@code {"topic": "...", "payload": {...}}}.
 */
public class MqttWebhookRequest {

  private String topic;
  private JsonNode payload;

  public MqttWebhookRequest() {}

  public MqttWebhookRequest(String topic, JsonNode payload) {
    this.topic = topic;
    this.payload = payload;
  }

  public String getTopic() {
    return topic;
  }

  public void setTopic(String topic) {
    this.topic = topic;
  }

  public JsonNode getPayload() {
    return payload;
  }

  public void setPayload(JsonNode payload) {
    this.payload = payload;
  }
}
