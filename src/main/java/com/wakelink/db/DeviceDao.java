package com.wakelink.db;

import com.wakelink.message.AliveMessage;
import com.wakelink.model.DeviceScheduleState;

import java.time.Instant;
import java.util.Optional;

/**
 * Поля устройства, которые меняет движок: «последний раз видели», состояние батареи и расписание.
 */
public interface DeviceDao {

  /**
   * Обновляет last_seen и данные из HELLO (батарея, версии прошивки и железа, RSSI).
   * Для незарегистрированного устройства ничего не делает.
   */
  void recordHello(AliveMessage hello, Instant seenAt);

  void recordSeen(String deviceId, Instant seenAt);

  /**
   * Фиксирует фактическое пробуждение и следующее расчётное.
   * Значения только продвигаются вперёд: более ранние метки не перезаписывают поздние.
   *
   * @return true, если запись обновлена.
   */
  boolean commitSchedule(String deviceId, Instant lastWakeAt, Instant nextWakeAt);

  Optional<DeviceScheduleState> findScheduleState(String deviceId);
}
