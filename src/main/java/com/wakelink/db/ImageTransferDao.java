package com.wakelink.db;

import com.wakelink.model.ArtifactKey;
import com.wakelink.model.ImageTransfer;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Записи о сборке снимков. На пару (устройство, имя снимка): не более одной записи.
 */
public interface ImageTransferDao {

  Optional<ImageTransfer> find(ArtifactKey key);

  Optional<ImageTransfer> findById(long transferId);

  /**
   * Создаёт запись, если для ключа её ещё нет.
   *
   * @return Новая или уже существующая запись.
   */
  ImageTransfer insertIfAbsent(ImageTransfer transfer);

  void update(ImageTransfer transfer);

  /**
   * Переводит передачу в FAILED, только если она всё ещё в статусе RECEIVING.
   *
   * @return true, если переход выполнен этим вызовом.
   */
  boolean markFailedIfReceiving(long transferId, String failureCode, Instant now);

  /**
   * Передачи в статусе RECEIVING без активности с момента cutoff.
   */
  List<ImageTransfer> findStaleReceiving(Instant cutoff);
}
