package com.wakelink.store;

import com.wakelink.db.FragmentDao;
import com.wakelink.model.ArtifactKey;
import com.wakelink.model.FragmentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Идемпотентное хранилище фрагментов.
 * <p>
 * Каждый ключ (устройство, снимок, индекс) записывается один раз: повторная доставка
 * не меняет содержимое. Срок жизни продлевается при каждом новом фрагменте снимка,
 * так что истекает только передача, по которой давно ничего не приходило.
 */
public class ChunkStore {

  private static final Logger logger = LoggerFactory.getLogger(ChunkStore.class);

  private final FragmentDao fragmentDao;
  private final Duration ttl;
  private final Clock clock;

  public ChunkStore(FragmentDao fragmentDao, Duration ttl, Clock clock) {
    this.fragmentDao = fragmentDao;
    this.ttl = ttl;
    this.clock = clock;
  }

  /**
   * Сохраняет фрагмент.
   *
   * @return true, если фрагмент новый; false для повторной доставки.
   */
  public boolean storeFragment(String deviceId, String artifactName, int index, byte[] data) {
    if (index < 0) {
      throw new IllegalArgumentException("Отрицательный индекс фрагмента: " + index);
    }
    Instant now = clock.instant();
    Instant expiresAt = now.plus(ttl);
    boolean inserted = fragmentDao.insertIfAbsent(
        new FragmentRecord(deviceId, artifactName, index, data, now, expiresAt));
    if (inserted) {
      fragmentDao.extendExpiry(new ArtifactKey(deviceId, artifactName), expiresAt);
    } else {
      logger.debug("Повторный фрагмент {} для {}/{} проигнорирован", index, deviceId, artifactName);
    }
    return inserted;
  }

  /**
   * Все индексы 0..total-1 присутствуют.
   */
  public boolean isComplete(ArtifactKey key, int total) {
    return total > 0 && missingIndices(key, total).isEmpty();
  }

  /**
   * Недостающие индексы в диапазоне 0..total-1 по возрастанию.
   */
  public List<Integer> missingIndices(ArtifactKey key, int total) {
    Set<Integer> present = new HashSet<>(fragmentDao.findIndices(key));
    List<Integer> missing = new ArrayList<>();
    for (int i = 0; i < total; i++) {
      if (!present.contains(i)) {
        missing.add(i);
      }
    }
    return missing;
  }

  /**
   * Количество сохранённых фрагментов в диапазоне 0..total-1.
   */
  public int receivedCount(ArtifactKey key, int total) {
    int count = 0;
    for (Integer index : fragmentDao.findIndices(key)) {
      if (index < total) {
        count++;
      }
    }
    return count;
  }

  public boolean isPresent(ArtifactKey key, int index) {
    return fragmentDao.findIndices(key).contains(index);
  }

  /**
   * Склеивает фрагменты 0..total-1 по порядку индексов.
   *
   * @throws AssemblyException если хотя бы одного фрагмента нет.
   */
  public byte[] assemble(ArtifactKey key, int total) throws AssemblyException {
    List<FragmentRecord> records = fragmentDao.findAll(key);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    List<Integer> missing = new ArrayList<>();
    int expected = 0;
    for (FragmentRecord record : records) {
      if (record.getIndex() >= total) {
        break;
      }
      while (expected < record.getIndex()) {
        missing.add(expected++);
      }
      out.write(record.getData(), 0, record.getData().length);
      expected++;
    }
    while (expected < total) {
      missing.add(expected++);
    }
    if (!missing.isEmpty()) {
      throw new AssemblyException(key, missing);
    }
    return out.toByteArray();
  }

  /**
   * Удаляет все фрагменты снимка.
   */
  public void clear(ArtifactKey key) {
    int deleted = fragmentDao.deleteAll(key);
    logger.debug("Очищено {} фрагментов для {}", deleted, key);
  }

  /**
   * Удаляет фрагменты с истёкшим сроком жизни.
   *
   * @return Снимки, у которых были удалены фрагменты.
   */
  public List<ArtifactKey> sweepExpired() {
    List<ArtifactKey> expired = fragmentDao.deleteExpired(clock.instant());
    if (!expired.isEmpty()) {
      logger.info("🧹 Удалены просроченные фрагменты снимков: {}", expired);
    }
    return expired;
  }

  public Duration getTtl() {
    return ttl;
  }
}
