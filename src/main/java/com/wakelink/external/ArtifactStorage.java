package com.wakelink.external;

/**
 * Объектное хранилище снимков.
 */
public interface ArtifactStorage {

  /**
   * Загружает снимок.
   *
   * @return Расположение снимка в хранилище.
   */
  String store(ArtifactUpload upload) throws ExternalCallException;
}
