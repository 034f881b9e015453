package com.wakelink.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wakelink.db.DatabaseConnection;
import com.wakelink.service.WakeEngine;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class HttpServerIntegrationTest {

  @Container
  private static final PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>("postgres:15")
          .withDatabaseName("wakelink")
          .withUsername("wakelink")
          .withPassword("wakelink");

  private static final String DEVICE = "98A316F82928";
  private static final ObjectMapper objectMapper = new ObjectMapper();

  private static DatabaseConnection database;
  private static WakeEngine engine;
  private static int serverPort;
  private static Channel mockChannel;
  private static EventLoopGroup bossGroup;
  private static EventLoopGroup workerGroup;
  private static final List<String[]> mockRequests = new CopyOnWriteArrayList<>();

  private static int freePort() throws IOException {
    try (var socket = new java.net.ServerSocket(0)) {
      return socket.getLocalPort();
    }
  }

  @BeforeAll
  static void setUp() throws Exception {
    database = new DatabaseConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    database.initializeDatabase();
    execute("INSERT INTO sites (site_id, site_name, company_id, timezone, wake_schedule_cron) "
        + "VALUES ('site-1', 'Теплица 1', 'company-1', 'UTC', '0 8,16 * * *')");
    execute("INSERT INTO devices (device_mac, site_id, provisioning_status, is_active) "
        + "VALUES ('" + DEVICE + "', 'site-1', 'active', TRUE)");

    // Один мок на все внешние сервисы: мост MQTT, хранилище и получатель уведомлений
    int mockPort = freePort();
    startMockServer(mockPort);
    String base = "http://127.0.0.1:" + mockPort;
    System.setProperty("broker.bridge.url", base + "/publish");
    System.setProperty("storage.base.url", base + "/storage");
    System.setProperty("downstream.completion.url", base + "/images/complete");
    System.setProperty("downstream.failure.url", base + "/images/failed");

    engine = WakeEngine.fromConfig(database, Clock.systemUTC());
    serverPort = freePort();
    Thread serverThread = new Thread(() -> {
      try {
        new HttpServer(serverPort, 1048576, engine.getService()).start();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    serverThread.setDaemon(true);
    serverThread.start();
    Thread.sleep(1200); // ждём запуска сервера
  }

  private static void startMockServer(int port) throws Exception {
    bossGroup = new NioEventLoopGroup(1);
    workerGroup = new NioEventLoopGroup();
    var bootstrap = new ServerBootstrap();
    bootstrap.group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            ch.pipeline().addLast(
                new HttpServerCodec(),
                new HttpObjectAggregator(1048576),
                new SimpleChannelInboundHandler<FullHttpRequest>() {
                  @Override
                  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
                    mockRequests.add(new String[]{
                        req.method().name(), req.uri(), req.content().toString(CharsetUtil.UTF_8)});
                    FullHttpResponse resp = new DefaultFullHttpResponse(
                        HttpVersion.HTTP_1_1,
                        HttpResponseStatus.OK,
                        Unpooled.copiedBuffer("{\"status\":\"ok\"}", CharsetUtil.UTF_8)
                    );
                    resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
                    resp.headers().set(HttpHeaderNames.CONTENT_LENGTH, resp.content().readableBytes());
                    ctx.writeAndFlush(resp);
                  }
                }
            );
          }
        });
    mockChannel = bootstrap.bind(port).sync().channel();
  }

  @AfterAll
  static void tearDown() {
    if (mockChannel != null) mockChannel.close();
    if (bossGroup != null) bossGroup.shutdownGracefully();
    if (workerGroup != null) workerGroup.shutdownGracefully();
  }

  @Test
  @DisplayName("Полный цикл пробуждения: снимок собран, загружен, устройство уснуло")
  void fullWakeCycle() throws Exception {
    HttpResponse<String> hello = webhook("status", "{\"status\":\"alive\",\"pendingImg\":1,\"battery_voltage\":3.9}");
    assertThat(hello.statusCode()).isEqualTo(200);
    assertThat(hello.body()).contains("processed");

    JsonNode capture = lastPublished("/cmd");
    assertThat(capture.get("capture_image").asBoolean()).isTrue();
    String imageName = capture.get("image_name").asText();

    assertThat(webhook("data", "{\"image_name\":\"" + imageName + "\",\"total_chunks_count\":3,"
        + "\"image_size\":3,\"max_chunk_size\":1,\"temperature\":21.5}").statusCode()).isEqualTo(200);
    for (int i = 0; i < 3; i++) {
      assertThat(webhook("data", "{\"image_name\":\"" + imageName + "\",\"chunk_id\":" + i
          + ",\"payload\":[" + (i == 0 ? 255 : i) + "]}").statusCode()).isEqualTo(200);
    }

    assertThat(requestsTo("/storage/")).hasSize(1);
    assertThat(requestsTo("/images/complete")).hasSize(1);
    JsonNode sleep = lastPublished("/cmd");
    assertThat(sleep.get("next_wake").asText()).matches("\\d{1,2}:00(AM|PM)");

    assertThat(query("SELECT status FROM image_transfers WHERE artifact_name = '" + imageName + "'"))
        .isEqualTo("complete");
    assertThat(query("SELECT protocol_state FROM wake_events WHERE artifact_name = '" + imageName + "'"))
        .isEqualTo("complete");
    assertThat(query("SELECT COUNT(*) FROM image_fragments WHERE artifact_name = '" + imageName + "'"))
        .isEqualTo("0");
    assertThat(query("SELECT next_wake_at IS NOT NULL FROM devices WHERE device_mac = '" + DEVICE + "'"))
        .isEqualTo("t");
  }

  @Test
  @DisplayName("Непривязанное устройство сразу получает команду сна")
  void unmappedDeviceSleeps() throws Exception {
    HttpResponse<String> resp = webhook("AABBCCDDEEFF", "status", "{\"status\":\"alive\"}");

    assertThat(resp.statusCode()).isEqualTo(200);
    assertThat(query("SELECT protocol_state FROM wake_events WHERE device_mac = 'AABBCCDDEEFF'"))
        .isEqualTo("sleep_only");
    assertThat(query("SELECT COUNT(*) FROM device_commands WHERE device_mac = 'AABBCCDDEEFF' "
        + "AND command_kind = 'sleep'")).isEqualTo("1");
  }

  @Test
  @DisplayName("Некорректное сообщение отклоняется с кодом 400")
  void malformedMessageRejected() throws Exception {
    HttpResponse<String> resp = webhook("data", "{\"image_name\":\"x.jpg\",\"chunk_id\":0,\"payload\":\"\"}");

    assertThat(resp.statusCode()).isEqualTo(400);
  }

  @Test
  @DisplayName("Проверка здоровья сервиса")
  void healthCheck() throws Exception {
    var req = HttpRequest.newBuilder()
        .uri(URI.create("http://localhost:" + serverPort + "/health"))
        .GET()
        .build();
    var resp = HttpClient.newHttpClient().send(req, HttpResponse.BodyHandlers.ofString());

    assertThat(resp.statusCode()).isEqualTo(200);
    assertThat(resp.body()).contains("wakelink-server");
  }

  private static HttpResponse<String> webhook(String suffix, String payload) throws Exception {
    return webhook(DEVICE, suffix, payload);
  }

  private static HttpResponse<String> webhook(String deviceId, String suffix, String payload) throws Exception {
    String body = "{\"topic\":\"ESP32CAM/" + deviceId + "/" + suffix + "\",\"payload\":" + payload + "}";
    var req = HttpRequest.newBuilder()
        .uri(URI.create("http://localhost:" + serverPort + "/mqtt"))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .build();
    return HttpClient.newHttpClient().send(req, HttpResponse.BodyHandlers.ofString());
  }

  private static List<String[]> requestsTo(String uriPrefix) {
    return mockRequests.stream()
        .filter(r -> r[1].startsWith(uriPrefix))
        .collect(Collectors.toList());
  }

  private static JsonNode lastPublished(String topicSuffix) throws Exception {
    JsonNode last = null;
    for (String[] request : requestsTo("/publish")) {
      JsonNode body = objectMapper.readTree(request[2]);
      if (body.get("topic").asText().endsWith(DEVICE + topicSuffix)) {
        last = body.get("payload");
      }
    }
    assertThat(last).as("команда в топик %s", topicSuffix).isNotNull();
    return last;
  }

  private static void execute(String sql) throws Exception {
    try (Connection conn = database.getConnection();
         Statement stmt = conn.createStatement()) {
      stmt.execute(sql);
    }
  }

  private static String query(String sql) throws Exception {
    try (Connection conn = database.getConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      assertThat(rs.next()).isTrue();
      return rs.getString(1);
    }
  }
}
