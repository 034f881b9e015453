package com.wakelink.protocol;

/**
 * Попытка перехода, отсутствующего в таблице переходов {@link ProtocolState}.
 */
public class IllegalStateTransitionException extends IllegalStateException {

  private final ProtocolState from;
  private final ProtocolState to;

  public IllegalStateTransitionException(ProtocolState from, ProtocolState to) {
    super("Недопустимый переход протокола: " + from.dbValue() + " → " + to.dbValue());
    this.from = from;
    this.to = to;
  }

  public ProtocolState getFrom() {
    return from;
  }

  public ProtocolState getTo() {
    return to;
  }
}
