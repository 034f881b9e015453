package com.wakelink.service;

import com.wakelink.command.CommandPublisher;
import com.wakelink.command.DeviceCommand;
import com.wakelink.db.DeviceDao;
import com.wakelink.db.ImageTransferDao;
import com.wakelink.db.WakeEventDao;
import com.wakelink.external.ArtifactStorage;
import com.wakelink.external.ArtifactUpload;
import com.wakelink.external.CompletionNotice;
import com.wakelink.external.CompletionNotifier;
import com.wakelink.external.ExternalCallException;
import com.wakelink.external.FailureCode;
import com.wakelink.external.FailureNotifier;
import com.wakelink.external.TransferFailure;
import com.wakelink.lineage.DeviceLineage;
import com.wakelink.lineage.LineageResolver;
import com.wakelink.model.ArtifactKey;
import com.wakelink.model.ImageTransfer;
import com.wakelink.model.WakeEvent;
import com.wakelink.protocol.ProtocolState;
import com.wakelink.schedule.NextWake;
import com.wakelink.schedule.WakeScheduleCalculator;
import com.wakelink.store.AssemblyException;
import com.wakelink.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Завершение передачи снимка.
 * <p>
 * Шаги: сборка → загрузка в хранилище → уведомление обработчика завершения →
 * передача COMPLETE → расчёт и фиксация следующего пробуждения → команда сна,
 * пробуждение COMPLETE → очистка фрагментов.
 * <p>
 * Запускается только для передачи в статусе RECEIVING, у которой есть все фрагменты.
 * После очистки фрагментов повторный вызов ничего не делает. Ошибка любого шага
 * фатальна для снимка: код сбоя передаётся обработчику сбоев, повторных попыток нет.
 */
public class Finalizer {

  private static final Logger logger = LoggerFactory.getLogger(Finalizer.class);

  private final ChunkStore chunkStore;
  private final ImageTransferDao transferDao;
  private final WakeEventDao wakeDao;
  private final DeviceDao deviceDao;
  private final LineageResolver lineageResolver;
  private final ArtifactStorage artifactStorage;
  private final CompletionNotifier completionNotifier;
  private final FailureReporter failureReporter;
  private final WakeScheduleCalculator scheduleCalculator;
  private final CommandPublisher commandPublisher;
  private final Clock clock;

  private final Set<ArtifactKey> inFlight = ConcurrentHashMap.newKeySet();

  public Finalizer(ChunkStore chunkStore, ImageTransferDao transferDao, WakeEventDao wakeDao, DeviceDao deviceDao,
                   LineageResolver lineageResolver, ArtifactStorage artifactStorage,
                   CompletionNotifier completionNotifier, FailureNotifier failureNotifier,
                   WakeScheduleCalculator scheduleCalculator, CommandPublisher commandPublisher, Clock clock) {
    this.chunkStore = chunkStore;
    this.transferDao = transferDao;
    this.wakeDao = wakeDao;
    this.deviceDao = deviceDao;
    this.lineageResolver = lineageResolver;
    this.artifactStorage = artifactStorage;
    this.completionNotifier = completionNotifier;
    this.failureReporter = new FailureReporter(failureNotifier);
    this.scheduleCalculator = scheduleCalculator;
    this.commandPublisher = commandPublisher;
    this.clock = clock;
  }

  /**
   * Завершает передачу, если все фрагменты получены.
   */
  public FinalizeOutcome finalizeTransfer(ArtifactKey key) {
    if (!inFlight.add(key)) {
      logger.debug("Завершение {} уже выполняется", key);
      return FinalizeOutcome.IN_PROGRESS;
    }
    try {
      return doFinalize(key);
    } finally {
      inFlight.remove(key);
    }
  }

  private FinalizeOutcome doFinalize(ArtifactKey key) {
    Optional<ImageTransfer> found = transferDao.find(key);
    if (found.isEmpty()) {
      return FinalizeOutcome.NOT_READY;
    }
    ImageTransfer transfer = found.get();
    if (!transfer.isReceiving()) {
      logger.debug("Передача {} уже в статусе {}, завершение пропущено", key, transfer.getStatus());
      return FinalizeOutcome.ALREADY_FINALIZED;
    }
    int total = transfer.getTotalFragments();
    if (!chunkStore.isComplete(key, total)) {
      return FinalizeOutcome.NOT_READY;
    }

    String deviceId = key.getDeviceId();
    WakeEvent wake = wakeDao.findLatestByTransfer(transfer.getId()).orElse(null);
    DeviceLineage lineage = lineageResolver.resolve(deviceId).orElse(null);

    // 1-2. Сборка и загрузка. Если снимок уже загружен прошлой попыткой, шаги пропускаются.
    String location = transfer.getStorageLocation();
    if (location == null) {
      byte[] image;
      try {
        image = chunkStore.assemble(key, total);
      } catch (AssemblyException e) {
        return fail(transfer, wake, FailureCode.ASSEMBLY_FAILED, e.getMessage());
      }
      try {
        location = artifactStorage.store(
            new ArtifactUpload(deviceId, key.getArtifactName(), image, lineage, transfer.getCapturedAt()));
      } catch (ExternalCallException e) {
        logger.error("❌ Загрузка снимка {} не удалась", key, e);
        return fail(transfer, wake, FailureCode.UPLOAD_FAILED, e.getMessage());
      }
      transfer.setStorageLocation(location);
      transferDao.update(transfer);
    } else {
      logger.info("Снимок {} уже загружен ({}), повторяем только уведомление", key, location);
    }

    // 3. Уведомление обработчика завершения
    try {
      completionNotifier.notifyCompletion(new CompletionNotice(deviceId, key.getArtifactName(), location,
          transfer.getId(), wake != null ? wake.getId() : null, lineage, transfer.getCapturedAt(), total));
    } catch (ExternalCallException e) {
      logger.error("❌ Обработчик завершения отклонил {}", key, e);
      return fail(transfer, wake, FailureCode.COMPLETION_FAILED, e.getMessage());
    }

    // 4. Передача завершена
    Instant now = clock.instant();
    transfer.markComplete(now);
    transferDao.update(transfer);
    if (wake != null && wake.getState() == ProtocolState.SNAP_SENT) {
      wake.transitionTo(ProtocolState.METADATA_RECEIVED, now);
    }

    // 5. Следующее пробуждение считаем от фактического пробуждения, расписание берём свежее
    DeviceLineage freshLineage = lineageResolver.resolve(deviceId).orElse(null);
    Instant actualWake = wake != null && wake.getHelloAt() != null ? wake.getHelloAt() : now;
    NextWake next = scheduleCalculator.nextWake(freshLineage, actualWake);
    if (!deviceDao.commitSchedule(deviceId, actualWake, next.getInstant())) {
      logger.warn("⚠️ Расписание устройства {} не сохранено: пробуждение {} или следующее {} раньше уже записанных",
          deviceId, actualWake, next.getInstant());
    }

    // 6. Команда сна
    if (!commandPublisher.publish(DeviceCommand.sleepUntil(deviceId, next.getDisplayTime()))) {
      logger.error("❌ Команда сна для {} не отправлена, устройство уснёт по своему таймеру", deviceId);
    }
    if (wake != null) {
      if (wake.getState() == ProtocolState.METADATA_RECEIVED) {
        wake.setNextWakeAt(next.getInstant());
        wake.setImagesCompleted(wake.getImagesCompleted() + 1);
        wake.transitionTo(ProtocolState.COMPLETE, clock.instant());
        wakeDao.update(wake);
      } else {
        logger.warn("⚠️ Пробуждение {} устройства {} уже в состоянии {}, не завершаем",
            wake.getId(), deviceId, wake.getState());
      }
    }

    // 7. Очистка
    chunkStore.clear(key);
    logger.info("✅ Снимок {} завершён, следующее пробуждение {}", key, next);
    return FinalizeOutcome.COMPLETED;
  }

  private FinalizeOutcome fail(ImageTransfer transfer, WakeEvent wake, FailureCode code, String message) {
    Instant now = clock.instant();
    transfer.markFailed(code.code(), now);
    transferDao.update(transfer);
    if (wake != null && !wake.getState().isTerminal()) {
      wake.fail(code.code(), now);
      wakeDao.update(wake);
    }
    failureReporter.report(new TransferFailure(transfer.getDeviceId(), transfer.getArtifactName(),
        transfer.getId(), code, message, now));
    return FinalizeOutcome.FAILED;
  }
}
