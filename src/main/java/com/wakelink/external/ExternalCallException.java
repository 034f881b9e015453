package com.wakelink.external;

/**
 * Ошибка вызова внешнего сервиса: статус не 2xx, ошибка ввода-вывода или таймаут.
 */
public class ExternalCallException extends Exception {

  public ExternalCallException(String message) {
    super(message);
  }

  public ExternalCallException(String message, Throwable cause) {
    super(message, cause);
  }
}
