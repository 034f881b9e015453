package com.wakelink.service;

/**
 * Результат попытки завершить передачу снимка.
 */
public enum FinalizeOutcome {
  /** Снимок загружен, устройство отправлено спать. */
  COMPLETED,
  /** Фрагментов ещё не хватает или передача неизвестна. */
  NOT_READY,
  /** Передача уже завершена или провалена; повторный вызов ничего не делает. */
  ALREADY_FINALIZED,
  /** Завершение этого снимка уже выполняется в другом потоке. */
  IN_PROGRESS,
  /** Один из шагов завершился ошибкой; сбой передан обработчику. */
  FAILED
}
