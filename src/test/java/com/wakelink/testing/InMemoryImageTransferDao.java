package com.wakelink.testing;

import com.wakelink.db.ImageTransferDao;
import com.wakelink.model.ArtifactKey;
import com.wakelink.model.ImageTransfer;
import com.wakelink.model.TransferStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Записи о передачах в памяти. Возвращает копии, как это делала бы БД.
 */
public class InMemoryImageTransferDao implements ImageTransferDao {

  private final Map<Long, ImageTransfer> rows = new LinkedHashMap<>();
  private long nextId = 1;

  @Override
  public synchronized Optional<ImageTransfer> find(ArtifactKey key) {
    for (ImageTransfer t : rows.values()) {
      if (t.key().equals(key)) {
        return Optional.of(copy(t));
      }
    }
    return Optional.empty();
  }

  @Override
  public synchronized Optional<ImageTransfer> findById(long transferId) {
    ImageTransfer t = rows.get(transferId);
    return t == null ? Optional.empty() : Optional.of(copy(t));
  }

  @Override
  public synchronized ImageTransfer insertIfAbsent(ImageTransfer transfer) {
    Optional<ImageTransfer> existing = find(transfer.key());
    if (existing.isPresent()) {
      return existing.get();
    }
    ImageTransfer stored = copy(transfer);
    stored.setId(nextId++);
    rows.put(stored.getId(), stored);
    return copy(stored);
  }

  @Override
  public synchronized void update(ImageTransfer transfer) {
    rows.put(transfer.getId(), copy(transfer));
  }

  @Override
  public synchronized boolean markFailedIfReceiving(long transferId, String failureCode, Instant now) {
    ImageTransfer t = rows.get(transferId);
    if (t == null || t.getStatus() != TransferStatus.RECEIVING) {
      return false;
    }
    t.markFailed(failureCode, now);
    return true;
  }

  @Override
  public synchronized List<ImageTransfer> findStaleReceiving(Instant cutoff) {
    List<ImageTransfer> result = new ArrayList<>();
    for (ImageTransfer t : rows.values()) {
      if (t.getStatus() == TransferStatus.RECEIVING && t.getLastActivityAt().isBefore(cutoff)) {
        result.add(copy(t));
      }
    }
    return result;
  }

  public synchronized List<ImageTransfer> all() {
    List<ImageTransfer> result = new ArrayList<>();
    for (ImageTransfer t : rows.values()) {
      result.add(copy(t));
    }
    return result;
  }

  private static ImageTransfer copy(ImageTransfer source) {
    ImageTransfer t = new ImageTransfer();
    t.setId(source.getId());
    t.setDeviceId(source.getDeviceId());
    t.setArtifactName(source.getArtifactName());
    t.setTotalFragments(source.getTotalFragments());
    t.setReceivedFragments(source.getReceivedFragments());
    t.setStatus(source.getStatus());
    t.setStorageLocation(source.getStorageLocation());
    t.setFailureCode(source.getFailureCode());
    t.setRetryCount(source.getRetryCount());
    t.setAwaitedTailIndex(source.getAwaitedTailIndex());
    t.setMissingRequests(source.getMissingRequests());
    t.setCapturedAt(source.getCapturedAt());
    t.setCreatedAt(source.getCreatedAt());
    t.setLastActivityAt(source.getLastActivityAt());
    t.setCompletedAt(source.getCompletedAt());
    t.setLastRequestAt(source.getLastRequestAt());
    return t;
  }
}
