package com.wakelink.protocol;

import com.wakelink.model.WakeEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Таблица переходов протокола пробуждения и метки этапов WakeEvent.
 */
class ProtocolStateTest {

  private static final Instant T0 = Instant.parse("2026-10-18T12:30:00Z");

  @Test
  @DisplayName("Основной путь HELLO → ACK → SNAP → METADATA → COMPLETE разрешён")
  void shouldAllowHappyPath() {
    assertThat(ProtocolState.HELLO_RECEIVED.canTransitionTo(ProtocolState.ACK_SENT)).isTrue();
    assertThat(ProtocolState.ACK_SENT.canTransitionTo(ProtocolState.SNAP_SENT)).isTrue();
    assertThat(ProtocolState.SNAP_SENT.canTransitionTo(ProtocolState.METADATA_RECEIVED)).isTrue();
    assertThat(ProtocolState.METADATA_RECEIVED.canTransitionTo(ProtocolState.COMPLETE)).isTrue();
  }

  @Test
  @DisplayName("SLEEP_ONLY достижим только из HELLO_RECEIVED")
  void sleepOnlyOnlyFromHello() {
    assertThat(ProtocolState.HELLO_RECEIVED.canTransitionTo(ProtocolState.SLEEP_ONLY)).isTrue();
    for (ProtocolState state : ProtocolState.values()) {
      if (state != ProtocolState.HELLO_RECEIVED) {
        assertThat(state.canTransitionTo(ProtocolState.SLEEP_ONLY)).as(state.name()).isFalse();
      }
    }
  }

  @Test
  @DisplayName("FAILED достижим из любого незавершённого состояния, финальные состояния без выходов")
  void failedFromAnyInFlightState() {
    for (ProtocolState state : ProtocolState.values()) {
      if (state.isTerminal()) {
        assertThat(state.allowedTransitions()).as(state.name()).isEmpty();
      } else {
        assertThat(state.canTransitionTo(ProtocolState.FAILED)).as(state.name()).isTrue();
      }
    }
    assertThat(ProtocolState.COMPLETE.isTerminal()).isTrue();
    assertThat(ProtocolState.SLEEP_ONLY.isTerminal()).isTrue();
    assertThat(ProtocolState.FAILED.isTerminal()).isTrue();
  }

  @Test
  @DisplayName("SNAP_SENT → SLEEP_ONLY падает с IllegalStateTransitionException")
  void illegalTransitionFailsLoudly() {
    WakeEvent wake = WakeEvent.hello("98A316F82928", 1, T0);
    wake.transitionTo(ProtocolState.ACK_SENT, T0);
    wake.transitionTo(ProtocolState.SNAP_SENT, T0);

    assertThatThrownBy(() -> wake.transitionTo(ProtocolState.SLEEP_ONLY, T0))
        .isInstanceOf(IllegalStateTransitionException.class)
        .satisfies(e -> {
          IllegalStateTransitionException ex = (IllegalStateTransitionException) e;
          assertThat(ex.getFrom()).isEqualTo(ProtocolState.SNAP_SENT);
          assertThat(ex.getTo()).isEqualTo(ProtocolState.SLEEP_ONLY);
        });
    assertThat(wake.getState()).isEqualTo(ProtocolState.SNAP_SENT);
  }

  @Test
  @DisplayName("Переходы проставляют метки времени этапов")
  void transitionsStampMilestones() {
    WakeEvent wake = WakeEvent.hello("98A316F82928", 1, T0);
    wake.transitionTo(ProtocolState.ACK_SENT, T0.plusSeconds(1));
    wake.transitionTo(ProtocolState.SNAP_SENT, T0.plusSeconds(2));
    wake.transitionTo(ProtocolState.METADATA_RECEIVED, T0.plusSeconds(3));
    wake.transitionTo(ProtocolState.COMPLETE, T0.plusSeconds(4));

    assertThat(wake.getHelloAt()).isEqualTo(T0);
    assertThat(wake.getAckSentAt()).isEqualTo(T0.plusSeconds(1));
    assertThat(wake.getSnapSentAt()).isEqualTo(T0.plusSeconds(2));
    assertThat(wake.getSleepSentAt()).isEqualTo(T0.plusSeconds(4));
    assertThat(wake.isComplete()).isTrue();
  }

  @Test
  @DisplayName("Значение для БД в нижнем регистре и обратно")
  void dbValueRoundTrip() {
    assertThat(ProtocolState.METADATA_RECEIVED.dbValue()).isEqualTo("metadata_received");
    assertThat(ProtocolState.fromDbValue("sleep_only")).isEqualTo(ProtocolState.SLEEP_ONLY);
  }

  @Test
  @DisplayName("Имя снимка строится из устройства и времени пробуждения в UTC")
  void artifactNameFromDeviceAndWake() {
    assertThat(ArtifactNames.forWake("98A316F82928", T0)).isEqualTo("98A316F82928_20261018_123000.jpg");
  }
}
