package com.wakelink.command;

/**
 * Отправка команд устройствам.
 */
public interface CommandPublisher {

  /**
   * Публикует команду.
   *
   * @return true, если брокер принял команду; false при ошибке или таймауте.
   */
  boolean publish(DeviceCommand command);
}
