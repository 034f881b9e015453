package com.wakelink.external;

/**
 * Обработчик завершённых снимков.
 */
public interface CompletionNotifier {

  void notifyCompletion(CompletionNotice notice) throws ExternalCallException;
}
