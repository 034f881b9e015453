package com.wakelink.testing;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Перехват сообщений журнала одного класса через Logback {@link ListAppender}.
 */
public class LogCapture implements AutoCloseable {

  private final Logger logger;
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

  public LogCapture(Class<?> type) {
    this.logger = (Logger) LoggerFactory.getLogger(type);
    appender.start();
    logger.addAppender(appender);
  }

  /**
   * Отформатированные сообщения уровня WARN.
   */
  public List<String> warnings() {
    List<String> messages = new ArrayList<>();
    for (ILoggingEvent event : appender.list) {
      if (event.getLevel() == Level.WARN) {
        messages.add(event.getFormattedMessage());
      }
    }
    return messages;
  }

  @Override
  public void close() {
    logger.detachAppender(appender);
    appender.stop();
  }
}
