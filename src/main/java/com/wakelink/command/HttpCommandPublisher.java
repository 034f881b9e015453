package com.wakelink.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wakelink.db.CommandAuditDao;
import com.wakelink.db.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;

/**
 * Публикация команд через HTTP-мост брокера.
 * <p>
 * Тело запроса: {@code {"topic": "...", "payload": {...}}}. Каждая попытка
 * записывается в журнал команд независимо от результата. Повторных попыток нет.
 */
public class HttpCommandPublisher implements CommandPublisher {

  private static final Logger logger = LoggerFactory.getLogger(HttpCommandPublisher.class);

  private final HttpClient httpClient;
  private final String bridgeUrl;
  private final Duration timeout;
  private final CommandAuditDao auditDao;
  private final Clock clock;
  private final ObjectMapper objectMapper;

  /**
   * Конструктор.
   *
   * @param httpClient HTTP-клиент.
   * @param bridgeUrl Адрес моста брокера.
   * @param timeout Таймаут одной публикации.
   * @param auditDao Журнал команд.
   * @param clock Часы для метки отправки.
   */
  public HttpCommandPublisher(HttpClient httpClient, String bridgeUrl, Duration timeout,
                              CommandAuditDao auditDao, Clock clock) {
    this.httpClient = httpClient;
    this.bridgeUrl = bridgeUrl;
    this.timeout = timeout;
    this.auditDao = auditDao;
    this.clock = clock;
    this.objectMapper = new ObjectMapper();
  }

  @Override
  public boolean publish(DeviceCommand command) {
    String error = null;
    try {
      send(command);
      logger.info("📤 {} → {}", command.getKind(), command.getTopic());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      error = "interrupted";
      logger.error("❌ Публикация {} для {} прервана", command.getKind(), command.getDeviceId());
    } catch (IOException e) {
      error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      logger.error("❌ Не удалось опубликовать {} для {}", command.getKind(), command.getDeviceId(), e);
    }
    audit(command, error);
    return error == null;
  }

  private void send(DeviceCommand command) throws IOException, InterruptedException {
    ObjectNode envelope = objectMapper.createObjectNode();
    envelope.put("topic", command.getTopic());
    envelope.set("payload", command.getPayload());

    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(bridgeUrl))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(envelope)))
        .timeout(timeout)
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() >= 400) {
      throw new IOException("Мост брокера вернул ошибку: " + response.statusCode());
    }
  }

  private void audit(DeviceCommand command, String error) {
    try {
      auditDao.record(command.getDeviceId(), command.getKind().auditName(), command.getTopic(),
          command.getPayload().toString(), error == null, error, clock.instant());
    } catch (DataAccessException e) {
      logger.warn("⚠️ Команда {} для {} не записана в журнал", command.getKind(), command.getDeviceId(), e);
    }
  }
}
