package com.wakelink.protocol;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Состояние протокола пробуждения устройства.
 * <p>
 * Основной путь: HELLO_RECEIVED → ACK_SENT → SNAP_SENT → METADATA_RECEIVED → COMPLETE.
 * Побочные выходы: SLEEP_ONLY (только из HELLO_RECEIVED, если устройство не привязано
 * или не одобрено) и FAILED (из любого незавершённого состояния).
 * Любой переход вне таблицы отклоняется с {@link IllegalStateTransitionException}.
 */
public enum ProtocolState {
  HELLO_RECEIVED,
  ACK_SENT,
  SNAP_SENT,
  METADATA_RECEIVED,
  COMPLETE,
  SLEEP_ONLY,
  FAILED;

  private static final Map<ProtocolState, Set<ProtocolState>> TRANSITIONS = new EnumMap<>(ProtocolState.class);

  static {
    TRANSITIONS.put(HELLO_RECEIVED, EnumSet.of(ACK_SENT, SLEEP_ONLY, FAILED));
    TRANSITIONS.put(ACK_SENT, EnumSet.of(SNAP_SENT, FAILED));
    TRANSITIONS.put(SNAP_SENT, EnumSet.of(METADATA_RECEIVED, FAILED));
    TRANSITIONS.put(METADATA_RECEIVED, EnumSet.of(COMPLETE, FAILED));
    TRANSITIONS.put(COMPLETE, EnumSet.noneOf(ProtocolState.class));
    TRANSITIONS.put(SLEEP_ONLY, EnumSet.noneOf(ProtocolState.class));
    TRANSITIONS.put(FAILED, EnumSet.noneOf(ProtocolState.class));
  }

  public boolean canTransitionTo(ProtocolState target) {
    return TRANSITIONS.get(this).contains(target);
  }

  public Set<ProtocolState> allowedTransitions() {
    return Collections.unmodifiableSet(TRANSITIONS.get(this));
  }

  public boolean isTerminal() {
    return TRANSITIONS.get(this).isEmpty();
  }

  /**
   * Пробуждение ждёт ответа устройства (снимок запрошен, передача ещё идёт).
   */
  public boolean isAwaitingArtifact() {
    return this == ACK_SENT || this == SNAP_SENT || this == METADATA_RECEIVED;
  }

  /**
   * Значение для колонки protocol_state, например "snap_sent".
   */
  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ProtocolState fromDbValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
