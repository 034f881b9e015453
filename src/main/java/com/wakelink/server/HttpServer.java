package com.wakelink.server;

import com.wakelink.config.Config;
import com.wakelink.db.DatabaseConnection;
import com.wakelink.service.WakeEngine;
import com.wakelink.service.WakeProtocolService;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Главный класс приложения. Запускает HTTP-сервер на Netty, принимающий
 * сообщения устройств от моста MQTT.
 */
public class HttpServer {

  private static final Logger logger = LoggerFactory.getLogger(HttpServer.class);

  private final int port;
  private final int maxContentLength;
  private final WakeProtocolService service;

  /**
   * Конструктор HTTP-сервера.
   * @param port Порт, на котором будет работать сервер.
   * @param maxContentLength Максимальный размер тела запроса в байтах.
   * @param service Сервис протокола пробуждения.
   */
  public HttpServer(int port, int maxContentLength, WakeProtocolService service) {
    this.port = port;
    this.maxContentLength = maxContentLength;
    this.service = service;
  }

  /**
   * Запускает сервер и ожидает завершения.
   * @throws InterruptedException если поток прерван во время работы сервера.
   */
  public void start() throws InterruptedException {
    EventLoopGroup bossGroup = new NioEventLoopGroup();
    EventLoopGroup workerGroup = new NioEventLoopGroup();
    try {
      ServerBootstrap b = new ServerBootstrap();
      b.group(bossGroup, workerGroup)
          .channel(NioServerSocketChannel.class)
          .childHandler(new ChannelInitializer<SocketChannel>() {
            @Override
            public void initChannel(SocketChannel ch) {
              ch.pipeline()
                  .addLast(new HttpServerCodec())
                  .addLast(new HttpObjectAggregator(maxContentLength))
                  .addLast(new HttpServerHandler(service));
            }
          })
          .option(ChannelOption.SO_BACKLOG, 128)
          .childOption(ChannelOption.SO_KEEPALIVE, true);

      ChannelFuture f = b.bind(port).sync();
      logger.info("🚀 Сервер запущен на http://localhost:{}", port);
      f.channel().closeFuture().sync();
    } finally {
      workerGroup.shutdownGracefully();
      bossGroup.shutdownGracefully();
    }
  }

  /**
   * Точка входа в приложение.
   * Инициализирует БД, запускает фоновую очистку передач и HTTP-сервер.
   * @param args Аргументы командной строки (не используются).
   * @throws InterruptedException если поток прерван.
   */
  public static void main(String[] args) throws InterruptedException {
    DatabaseConnection database = DatabaseConnection.fromConfig();
    database.initializeDatabase();

    WakeEngine engine = WakeEngine.fromConfig(database, Clock.systemUTC());
    engine.getSweeper().start();
    try {
      new HttpServer(
          Config.getInt("server.port", 8081),
          Config.getInt("server.max.content.length", 1048576),
          engine.getService()
      ).start();
    } finally {
      engine.getSweeper().stop();
    }
  }
}
