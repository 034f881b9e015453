package com.wakelink.service;

/**
 * Результат обработки одного входящего сообщения.
 */
public enum MessageOutcome {
  /** Сообщение обработано. */
  PROCESSED,
  /** Сообщение некорректно и отброшено без изменения состояния. */
  DISCARDED,
  /** Сообщение корректно, но обработка завершилась ошибкой (сбой передан обработчику сбоев). */
  FAILED
}
