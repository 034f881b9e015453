package com.wakelink.db;

/**
 * Ошибка доступа к базе данных. Оборачивает {@link java.sql.SQLException}.
 */
public class DataAccessException extends RuntimeException {

  public DataAccessException(String message, Throwable cause) {
    super(message, cause);
  }
}
