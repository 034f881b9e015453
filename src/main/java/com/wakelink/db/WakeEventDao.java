package com.wakelink.db;

import com.wakelink.model.WakeEvent;

import java.util.List;
import java.util.Optional;

/**
 * Журнал пробуждений. Записи только добавляются и обновляются, не удаляются.
 */
public interface WakeEventDao {

  /**
   * Сохраняет новое пробуждение и проставляет ему идентификатор.
   */
  WakeEvent insert(WakeEvent wake);

  void update(WakeEvent wake);

  Optional<WakeEvent> findById(long wakeId);

  /**
   * Последнее пробуждение устройства, ожидающее снимок (ACK_SENT, SNAP_SENT, METADATA_RECEIVED).
   */
  Optional<WakeEvent> findOpenByDevice(String deviceId);

  /**
   * Последнее пробуждение, связанное с передачей.
   */
  Optional<WakeEvent> findLatestByTransfer(long transferId);

  List<WakeEvent> findByDevice(String deviceId);
}
