package com.wakelink.message;

/**
 * Сообщение не удалось разобрать. Оно отбрасывается без изменения состояния.
 */
public class MalformedMessageException extends Exception {

  public MalformedMessageException(String message) {
    super(message);
  }

  public MalformedMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
