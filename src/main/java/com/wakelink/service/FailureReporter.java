package com.wakelink.service;

import com.wakelink.external.ExternalCallException;
import com.wakelink.external.FailureNotifier;
import com.wakelink.external.TransferFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Единая точка передачи сбоев наружу. Ошибка самого обработчика сбоев только логируется.
 */
class FailureReporter {

  private static final Logger logger = LoggerFactory.getLogger(FailureReporter.class);

  private final FailureNotifier notifier;

  FailureReporter(FailureNotifier notifier) {
    this.notifier = notifier;
  }

  void report(TransferFailure failure) {
    logger.error("❌ Сбой передачи: {}", failure);
    try {
      notifier.notifyFailure(failure);
    } catch (ExternalCallException e) {
      logger.error("❌ Обработчик сбоев недоступен, сбой {} для {} не доставлен",
          failure.getCode().code(), failure.getDeviceId(), e);
    }
  }
}
