package com.wakelink.external;

/**
 * Обработчик сбоев: алерты и пометка записей.
 */
public interface FailureNotifier {

  void notifyFailure(TransferFailure failure) throws ExternalCallException;
}
