package com.wakelink.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Сервис обработки сообщений протокола пробуждения.
 */
public interface WakeProtocolService {

  /**
   * Обрабатывает сообщение устройства.
   *
   * @param topic Тема брокера, например {@code ESP32CAM/98A316F82928/data}.
   * @param payload JSON-тело сообщения.
   * @return Результат обработки. Исключения наружу не выбрасываются.
   */
  MessageOutcome handleMessage(String topic, JsonNode payload);
}
