package com.wakelink.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.wakelink.service.MessageOutcome;
import com.wakelink.service.WakeProtocolService;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Модульные тесты для HttpServerHandler.
 * <p>
 * Проверяют HTTP-уровень: разбор вебхука, коды ответа.
 * Протокол (WakeProtocolService) замокан, но проверяется,
 * что в него передаются топик и тело сообщения.
 */
class HttpServerHandlerTest {

  private static final String WEBHOOK =
      "{\"topic\":\"ESP32CAM/98A316F82928/status\",\"payload\":{\"status\":\"alive\",\"pendingImg\":1}}";

  @Mock
  private WakeProtocolService service;

  @Mock
  private ChannelHandlerContext ctx;

  @Mock
  private ChannelPromise channelPromise;

  private HttpServerHandler handler;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    handler = new HttpServerHandler(service);

    // Настраиваем моки так, чтобы ctx.writeAndFlush не падал
    when(ctx.writeAndFlush(any())).thenReturn(channelPromise);
    when(channelPromise.addListener(any())).thenReturn(channelPromise);
  }

  private static FullHttpRequest post(String uri, String body) {
    FullHttpRequest request = new DefaultFullHttpRequest(
        HttpVersion.HTTP_1_1,
        HttpMethod.POST,
        uri,
        Unpooled.wrappedBuffer(body.getBytes(StandardCharsets.UTF_8))
    );
    request.headers().set(HttpHeaderNames.CONTENT_LENGTH, body.length());
    request.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
    return request;
  }

  private FullHttpResponse captureResponse() {
    ArgumentCaptor<FullHttpResponse> responseCaptor = ArgumentCaptor.forClass(FullHttpResponse.class);
    verify(ctx).writeAndFlush(responseCaptor.capture());
    return responseCaptor.getValue();
  }

  @Test
  @DisplayName("POST /mqtt → топик и payload передаются в сервис")
  void shouldPassTopicAndPayloadToService() {
    // Given
    when(service.handleMessage(anyString(), any())).thenReturn(MessageOutcome.PROCESSED);

    // When
    handler.channelRead0(ctx, post("/mqtt", WEBHOOK));

    // Then
    ArgumentCaptor<JsonNode> payload = ArgumentCaptor.forClass(JsonNode.class);
    verify(service).handleMessage(eq("ESP32CAM/98A316F82928/status"), payload.capture());
    assertThat(payload.getValue().get("pendingImg").asInt()).isEqualTo(1);
  }

  @Test
  @DisplayName("Сообщение обработано → 200 OK")
  void shouldReturn200WhenProcessed() {
    when(service.handleMessage(anyString(), any())).thenReturn(MessageOutcome.PROCESSED);

    handler.channelRead0(ctx, post("/mqtt", WEBHOOK));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("\"status\":\"processed\"");
  }

  @Test
  @DisplayName("Сбой обработки → всё равно 200, сбой уже передан обработчику")
  void shouldReturn200WhenProcessingFailed() {
    when(service.handleMessage(anyString(), any())).thenReturn(MessageOutcome.FAILED);

    handler.channelRead0(ctx, post("/mqtt", WEBHOOK));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("\"status\":\"failed\"");
  }

  @Test
  @DisplayName("Некорректное сообщение устройства → 400 Bad Request")
  void shouldReturn400WhenDiscarded() {
    when(service.handleMessage(anyString(), any())).thenReturn(MessageOutcome.DISCARDED);

    handler.channelRead0(ctx, post("/mqtt", WEBHOOK));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("\"error\":\"Malformed message\"");
  }

  @Test
  @DisplayName("Невалидный JSON → 400 Bad Request, сервис не вызывается")
  void shouldReturn400WhenJsonIsInvalid() {
    handler.channelRead0(ctx, post("/mqtt", "{invalid"));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("\"error\":\"Invalid webhook body\"");
    verifyNoInteractions(service);
  }

  @Test
  @DisplayName("Вебхук без топика → 400 Bad Request")
  void shouldReturn400WhenTopicMissing() {
    handler.channelRead0(ctx, post("/mqtt", "{\"payload\":{}}"));

    assertThat(captureResponse().status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    verifyNoInteractions(service);
  }

  @Test
  @DisplayName("GET /health → 200 OK")
  void shouldReturnHealth() {
    FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/health");

    handler.channelRead0(ctx, request);

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("wakelink-server");
  }

  @Test
  @DisplayName("Неверный URI → 404 Not Found")
  void shouldReturn404ForUnknownPath() {
    // Given
    FullHttpRequest request = new DefaultFullHttpRequest(
        HttpVersion.HTTP_1_1,
        HttpMethod.POST,
        "/telemetry",
        Unpooled.EMPTY_BUFFER
    );

    // When
    handler.channelRead0(ctx, request);

    // Then
    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.NOT_FOUND);
    assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("\"error\":\"404\"");
  }
}
