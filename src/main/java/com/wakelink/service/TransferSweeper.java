package com.wakelink.service;

import com.wakelink.command.CommandPublisher;
import com.wakelink.command.DeviceCommand;
import com.wakelink.db.ImageTransferDao;
import com.wakelink.db.WakeEventDao;
import com.wakelink.external.FailureCode;
import com.wakelink.external.FailureNotifier;
import com.wakelink.external.TransferFailure;
import com.wakelink.model.ArtifactKey;
import com.wakelink.model.ImageTransfer;
import com.wakelink.model.WakeEvent;
import com.wakelink.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Фоновая очистка зависших передач.
 * <p>
 * Удаляет просроченные фрагменты и переводит передачи без активности дольше TTL в FAILED
 * с кодом {@code transfer_expired}. Переход условный (только из RECEIVING), поэтому
 * уведомление о сбое отправляется ровно один раз, сколько бы проходов ни было.
 * <p>
 * Передаче без активности дольше половины TTL отправляется запрос недостающих фрагментов,
 * не чаще одного раза за половину TTL. Срок жизни передачи при этом не продлевается.
 */
public class TransferSweeper {

  private static final Logger logger = LoggerFactory.getLogger(TransferSweeper.class);

  private final ChunkStore chunkStore;
  private final ImageTransferDao transferDao;
  private final WakeEventDao wakeDao;
  private final CommandPublisher commandPublisher;
  private final FailureReporter failureReporter;
  private final Clock clock;
  private final Duration interval;

  private ScheduledExecutorService executor;
  private ScheduledFuture<?> task;

  public TransferSweeper(ChunkStore chunkStore, ImageTransferDao transferDao, WakeEventDao wakeDao,
                         CommandPublisher commandPublisher, FailureNotifier failureNotifier, Clock clock,
                         Duration interval) {
    this.chunkStore = chunkStore;
    this.transferDao = transferDao;
    this.wakeDao = wakeDao;
    this.commandPublisher = commandPublisher;
    this.failureReporter = new FailureReporter(failureNotifier);
    this.clock = clock;
    this.interval = interval;
  }

  /**
   * Запускает периодическую очистку в отдельном потоке.
   */
  public synchronized void start() {
    if (executor != null) {
      return;
    }
    executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread thread = new Thread(r, "transfer-sweeper");
      thread.setDaemon(true);
      return thread;
    });
    task = executor.scheduleWithFixedDelay(this::sweepSafely, interval.toMillis(), interval.toMillis(),
        TimeUnit.MILLISECONDS);
    logger.info("🧹 Очистка передач запущена: каждые {} с, TTL {} мин",
        interval.toSeconds(), chunkStore.getTtl().toMinutes());
  }

  public synchronized void stop() {
    if (executor == null) {
      return;
    }
    task.cancel(false);
    executor.shutdown();
    executor = null;
    task = null;
  }

  /**
   * Один проход очистки.
   *
   * @return Количество передач, переведённых в FAILED этим проходом.
   */
  public int sweep() {
    Instant now = clock.instant();
    Map<ArtifactKey, ImageTransfer> candidates = new LinkedHashMap<>();
    for (ArtifactKey key : chunkStore.sweepExpired()) {
      Optional<ImageTransfer> transfer = transferDao.find(key);
      if (transfer.isPresent() && transfer.get().isReceiving()) {
        candidates.put(key, transfer.get());
      }
    }
    for (ImageTransfer stale : transferDao.findStaleReceiving(now.minus(chunkStore.getTtl()))) {
      candidates.putIfAbsent(stale.key(), stale);
    }

    int expired = 0;
    for (ImageTransfer transfer : candidates.values()) {
      if (!transferDao.markFailedIfReceiving(transfer.getId(), FailureCode.TRANSFER_EXPIRED.code(), now)) {
        continue;
      }
      expired++;
      chunkStore.clear(transfer.key());
      failWake(transfer, now);
      failureReporter.report(new TransferFailure(transfer.getDeviceId(), transfer.getArtifactName(),
          transfer.getId(), FailureCode.TRANSFER_EXPIRED,
          "Нет новых фрагментов дольше " + chunkStore.getTtl().toMinutes() + " мин", now));
    }
    if (expired > 0) {
      logger.warn("⚠️ Просрочено передач: {}", expired);
    }
    requestIdleGaps(now);
    return expired;
  }

  /**
   * Запрашивает недостающие фрагменты у передач, затихших дольше половины TTL.
   *
   * @return Количество отправленных запросов.
   */
  int requestIdleGaps(Instant now) {
    Instant cutoff = now.minus(chunkStore.getTtl().dividedBy(2));
    int requested = 0;
    for (ImageTransfer idle : transferDao.findStaleReceiving(cutoff)) {
      if (idle.getLastRequestAt() != null && !idle.getLastRequestAt().isBefore(cutoff)) {
        continue;
      }
      List<Integer> missing = chunkStore.missingIndices(idle.key(), idle.getTotalFragments());
      if (missing.isEmpty()) {
        continue;
      }
      logger.info("🧩 Снимок {} молчит с {}: повторный запрос фрагментов {}",
          idle.key(), idle.getLastActivityAt(), missing);
      if (!commandPublisher.publish(
          DeviceCommand.missingFragments(idle.getDeviceId(), idle.getArtifactName(), missing))) {
        logger.error("❌ Запрос недостающих фрагментов для {} не отправлен", idle.key());
      }
      idle.setAwaitedTailIndex(missing.get(missing.size() - 1));
      idle.setMissingRequests(idle.getMissingRequests() + 1);
      idle.setLastRequestAt(now);
      transferDao.update(idle);
      requested++;
    }
    return requested;
  }

  private void failWake(ImageTransfer transfer, Instant now) {
    Optional<WakeEvent> wake = wakeDao.findLatestByTransfer(transfer.getId());
    if (wake.isPresent() && !wake.get().getState().isTerminal()) {
      wake.get().fail(FailureCode.TRANSFER_EXPIRED.code(), now);
      wakeDao.update(wake.get());
    }
  }

  private void sweepSafely() {
    try {
      sweep();
    } catch (RuntimeException e) {
      logger.error("❌ Ошибка фоновой очистки передач", e);
    }
  }
}
