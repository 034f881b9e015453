package com.wakelink.lineage;

import java.util.Optional;

/**
 * Разрешение цепочки владения устройства.
 */
public interface LineageResolver {

  /**
   * @param deviceId Нормализованный идентификатор устройства.
   * @return Цепочка владения или пустой Optional, если устройство неизвестно.
   */
  Optional<DeviceLineage> resolve(String deviceId);
}
