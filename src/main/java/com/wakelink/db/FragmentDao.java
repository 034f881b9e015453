package com.wakelink.db;

import com.wakelink.model.ArtifactKey;
import com.wakelink.model.FragmentRecord;

import java.time.Instant;
import java.util.List;

/**
 * Хранилище фрагментов снимков. Запись по ключу выполняется не более одного раза.
 */
public interface FragmentDao {

  /**
   * Сохраняет фрагмент, если его ещё нет.
   *
   * @return true, если запись добавлена; false, если ключ уже существовал.
   */
  boolean insertIfAbsent(FragmentRecord record);

  /**
   * Продлевает срок жизни всех фрагментов снимка.
   */
  void extendExpiry(ArtifactKey key, Instant expiresAt);

  /**
   * Индексы сохранённых фрагментов по возрастанию.
   */
  List<Integer> findIndices(ArtifactKey key);

  /**
   * Все фрагменты снимка по возрастанию индекса.
   */
  List<FragmentRecord> findAll(ArtifactKey key);

  int deleteAll(ArtifactKey key);

  /**
   * Удаляет фрагменты с истёкшим сроком жизни.
   *
   * @return Ключи снимков, у которых были удалены фрагменты.
   */
  List<ArtifactKey> deleteExpired(Instant now);
}
