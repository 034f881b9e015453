package com.wakelink.testing;

import com.wakelink.db.FragmentDao;
import com.wakelink.model.ArtifactKey;
import com.wakelink.model.FragmentRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Хранилище фрагментов в памяти с той же семантикой, что и таблица image_fragments.
 */
public class InMemoryFragmentDao implements FragmentDao {

  private final Map<ArtifactKey, TreeMap<Integer, FragmentRecord>> fragments = new ConcurrentHashMap<>();

  @Override
  public synchronized boolean insertIfAbsent(FragmentRecord record) {
    ArtifactKey key = new ArtifactKey(record.getDeviceId(), record.getArtifactName());
    TreeMap<Integer, FragmentRecord> byIndex = fragments.computeIfAbsent(key, k -> new TreeMap<>());
    if (byIndex.containsKey(record.getIndex())) {
      return false;
    }
    byIndex.put(record.getIndex(), record);
    return true;
  }

  @Override
  public synchronized void extendExpiry(ArtifactKey key, Instant expiresAt) {
    TreeMap<Integer, FragmentRecord> byIndex = fragments.get(key);
    if (byIndex == null) {
      return;
    }
    for (Map.Entry<Integer, FragmentRecord> entry : byIndex.entrySet()) {
      FragmentRecord r = entry.getValue();
      entry.setValue(new FragmentRecord(r.getDeviceId(), r.getArtifactName(), r.getIndex(), r.getData(),
          r.getStoredAt(), expiresAt));
    }
  }

  @Override
  public synchronized List<Integer> findIndices(ArtifactKey key) {
    TreeMap<Integer, FragmentRecord> byIndex = fragments.get(key);
    return byIndex == null ? new ArrayList<>() : new ArrayList<>(byIndex.keySet());
  }

  @Override
  public synchronized List<FragmentRecord> findAll(ArtifactKey key) {
    TreeMap<Integer, FragmentRecord> byIndex = fragments.get(key);
    return byIndex == null ? new ArrayList<>() : new ArrayList<>(byIndex.values());
  }

  @Override
  public synchronized int deleteAll(ArtifactKey key) {
    TreeMap<Integer, FragmentRecord> removed = fragments.remove(key);
    return removed == null ? 0 : removed.size();
  }

  @Override
  public synchronized List<ArtifactKey> deleteExpired(Instant now) {
    Set<ArtifactKey> touched = new LinkedHashSet<>();
    for (Map.Entry<ArtifactKey, TreeMap<Integer, FragmentRecord>> entry : fragments.entrySet()) {
      Iterator<FragmentRecord> it = entry.getValue().values().iterator();
      while (it.hasNext()) {
        if (!it.next().getExpiresAt().isAfter(now)) {
          it.remove();
          touched.add(entry.getKey());
        }
      }
    }
    fragments.values().removeIf(TreeMap::isEmpty);
    return new ArrayList<>(touched);
  }

  /**
   * Количество строк для ключа (для проверки идемпотентности).
   */
  public synchronized int rowCount(ArtifactKey key) {
    TreeMap<Integer, FragmentRecord> byIndex = fragments.get(key);
    return byIndex == null ? 0 : byIndex.size();
  }
}
