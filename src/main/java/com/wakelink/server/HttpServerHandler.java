package com.wakelink.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wakelink.service.MessageOutcome;
import com.wakelink.service.WakeProtocolService;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Обработчик HTTP-запросов от моста MQTT.
 * <p>
 * Делегирует обработку сообщений сервису {@link com.wakelink.service.WakeProtocolService}.
 */
public class HttpServerHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

  private static final Logger logger = LoggerFactory.getLogger(HttpServerHandler.class);

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final WakeProtocolService service;

  /**
   * Конструктор обработчика.
   *
   * @param service Сервис протокола пробуждения.
   */
  public HttpServerHandler(WakeProtocolService service) {
    this.service = service;
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
    String uri = request.uri();
    HttpMethod method = request.method();
    logger.debug("📥 {} {}", method, uri);

    FullHttpResponse response;

    if (method == HttpMethod.POST && "/mqtt".equals(uri)) {
      response = handleWebhook(request);
    } else if (method == HttpMethod.GET && "/health".equals(uri)) {
      response = createJsonResponse(HttpResponseStatus.OK, "{\"status\":\"ok\",\"service\":\"wakelink-server\"}");
    } else {
      response = createJsonResponse(HttpResponseStatus.NOT_FOUND, "{\"error\":\"404\"}");
    }

    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
  }

  private FullHttpResponse handleWebhook(FullHttpRequest request) {
    MqttWebhookRequest webhook;
    try {
      String body = request.content().toString(CharsetUtil.UTF_8);
      webhook = MAPPER.readValue(body, MqttWebhookRequest.class);
    } catch (JsonProcessingException e) {
      logger.warn("⚠️ Некорректное тело вебхука: {}", e.getOriginalMessage());
      return createJsonResponse(HttpResponseStatus.BAD_REQUEST, "{\"error\":\"Invalid webhook body\"}");
    }
    if (webhook == null || webhook.getTopic() == null || webhook.getPayload() == null) {
      return createJsonResponse(HttpResponseStatus.BAD_REQUEST, "{\"error\":\"Missing topic or payload\"}");
    }

    MessageOutcome outcome = service.handleMessage(webhook.getTopic(), webhook.getPayload());
    switch (outcome) {
      case PROCESSED:
        return createJsonResponse(HttpResponseStatus.OK, "{\"status\":\"processed\"}");
      case DISCARDED:
        return createJsonResponse(HttpResponseStatus.BAD_REQUEST, "{\"error\":\"Malformed message\"}");
      default:
        // Устройство не ждёт ответа, сбой уже передан обработчику сбоев
        return createJsonResponse(HttpResponseStatus.OK, "{\"status\":\"failed\"}");
    }
  }

  private FullHttpResponse createJsonResponse(HttpResponseStatus status, String body) {
    FullHttpResponse res = new DefaultFullHttpResponse(
        HttpVersion.HTTP_1_1,
        status,
        Unpooled.copiedBuffer(body, CharsetUtil.UTF_8)
    );
    res.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
    res.headers().set(HttpHeaderNames.CONTENT_LENGTH, res.content().readableBytes());
    return res;
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("❌ Ошибка канала", cause);
    ctx.close();
  }
}
