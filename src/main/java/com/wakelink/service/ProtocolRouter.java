package com.wakelink.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.wakelink.command.CommandPublisher;
import com.wakelink.command.DeviceCommand;
import com.wakelink.db.DeviceDao;
import com.wakelink.db.ImageTransferDao;
import com.wakelink.db.TelemetryDao;
import com.wakelink.db.WakeEventDao;
import com.wakelink.external.FailureCode;
import com.wakelink.external.FailureNotifier;
import com.wakelink.external.TransferFailure;
import com.wakelink.lineage.DeviceLineage;
import com.wakelink.lineage.LineageResolver;
import com.wakelink.message.AliveMessage;
import com.wakelink.message.FragmentMessage;
import com.wakelink.message.InboundMessage;
import com.wakelink.message.MalformedMessageException;
import com.wakelink.message.MessageParser;
import com.wakelink.message.MetadataMessage;
import com.wakelink.message.TelemetryMessage;
import com.wakelink.model.ArtifactKey;
import com.wakelink.model.ImageTransfer;
import com.wakelink.model.TransferStatus;
import com.wakelink.model.WakeEvent;
import com.wakelink.protocol.ArtifactNames;
import com.wakelink.protocol.ProtocolState;
import com.wakelink.schedule.NextWake;
import com.wakelink.schedule.WakeScheduleCalculator;
import com.wakelink.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Маршрутизатор протокола пробуждения.
 * <p>
 * Для каждого входящего сообщения определяет состояние пробуждения и выполняет переход:
 * <ul>
 *   <li>HELLO → новое пробуждение; неизвестное или не одобренное устройство сразу уходит в сон,
 *       иначе получает запрос снимка;</li>
 *   <li>метаданные → запись передачи, привязка к открытому пробуждению;</li>
 *   <li>фрагмент → хранилище фрагментов, при полноте: {@link Finalizer},
 *       при приходе ожидаемого последнего фрагмента с пропусками: один запрос недостающих;</li>
 *   <li>телеметрия → только строка телеметрии и отметка «последний раз видели».</li>
 * </ul>
 * Некорректные сообщения отбрасываются без изменения состояния.
 */
public class ProtocolRouter implements WakeProtocolService {

  private static final Logger logger = LoggerFactory.getLogger(ProtocolRouter.class);

  static final String SUPERSEDED = "superseded_by_new_wake";

  private static final byte JPEG_SOI_1 = (byte) 0xFF;
  private static final byte JPEG_SOI_2 = (byte) 0xD8;

  private final MessageParser parser;
  private final WakeEventDao wakeDao;
  private final ImageTransferDao transferDao;
  private final DeviceDao deviceDao;
  private final TelemetryDao telemetryDao;
  private final LineageResolver lineageResolver;
  private final ChunkStore chunkStore;
  private final WakeScheduleCalculator scheduleCalculator;
  private final CommandPublisher commandPublisher;
  private final Finalizer finalizer;
  private final FailureReporter failureReporter;
  private final Clock clock;

  public ProtocolRouter(MessageParser parser, WakeEventDao wakeDao, ImageTransferDao transferDao,
                        DeviceDao deviceDao, TelemetryDao telemetryDao, LineageResolver lineageResolver,
                        ChunkStore chunkStore, WakeScheduleCalculator scheduleCalculator,
                        CommandPublisher commandPublisher, Finalizer finalizer,
                        FailureNotifier failureNotifier, Clock clock) {
    this.parser = parser;
    this.wakeDao = wakeDao;
    this.transferDao = transferDao;
    this.deviceDao = deviceDao;
    this.telemetryDao = telemetryDao;
    this.lineageResolver = lineageResolver;
    this.chunkStore = chunkStore;
    this.scheduleCalculator = scheduleCalculator;
    this.commandPublisher = commandPublisher;
    this.finalizer = finalizer;
    this.failureReporter = new FailureReporter(failureNotifier);
    this.clock = clock;
  }

  @Override
  public MessageOutcome handleMessage(String topic, JsonNode payload) {
    InboundMessage message;
    try {
      message = parser.parse(topic, payload);
    } catch (MalformedMessageException e) {
      logger.warn("⚠️ Сообщение отброшено: {}", e.getMessage());
      return MessageOutcome.DISCARDED;
    }

    try {
      switch (message.getType()) {
        case ALIVE:
          handleAlive((AliveMessage) message);
          break;
        case METADATA:
          handleMetadata((MetadataMessage) message);
          break;
        case FRAGMENT:
          handleFragment((FragmentMessage) message);
          break;
        case TELEMETRY:
          handleTelemetry((TelemetryMessage) message);
          break;
        default:
          throw new IllegalStateException("Неизвестный тип сообщения: " + message.getType());
      }
      return MessageOutcome.PROCESSED;
    } catch (RuntimeException e) {
      logger.error("❌ Ошибка обработки {} от {}", message.getType(), message.getDeviceId(), e);
      failureReporter.report(new TransferFailure(message.getDeviceId(), artifactNameOf(message), null,
          FailureCode.PROCESSING_ERROR, String.valueOf(e.getMessage()), clock.instant()));
      return MessageOutcome.FAILED;
    }
  }

  private void handleAlive(AliveMessage hello) {
    String deviceId = hello.getDeviceId();
    Instant now = clock.instant();
    logger.info("👋 HELLO от {} (pending={})", deviceId, hello.getPendingCount());

    deviceDao.recordHello(hello, now);
    supersedeOpenWake(deviceId, now);

    WakeEvent wake = wakeDao.insert(WakeEvent.hello(deviceId, hello.getPendingCount(), now));
    DeviceLineage lineage = lineageResolver.resolve(deviceId).orElse(null);

    if (lineage == null || !lineage.isMapped() || !lineage.isApproved()) {
      NextWake next = scheduleCalculator.nextWake(lineage, now);
      wake.transitionTo(ProtocolState.SLEEP_ONLY, now);
      wake.setNextWakeAt(next.getInstant());
      wakeDao.update(wake);
      if (!deviceDao.commitSchedule(deviceId, now, next.getInstant())) {
        logger.warn("⚠️ Расписание устройства {} не сохранено: следующее пробуждение {} раньше уже записанного",
            deviceId, next.getInstant());
      }
      logger.info("Устройство {} не привязано или не одобрено, сон до {}", deviceId, next.getDisplayTime());
      if (!commandPublisher.publish(DeviceCommand.sleepUntil(deviceId, next.getDisplayTime()))) {
        logger.error("❌ Команда сна для непривязанного устройства {} не отправлена", deviceId);
      }
      return;
    }

    String artifactName = ArtifactNames.forWake(deviceId, now);
    wake.setArtifactName(artifactName);
    wake.setImagesRequested(wake.getImagesRequested() + 1);
    wake.transitionTo(ProtocolState.ACK_SENT, now);
    wakeDao.update(wake);

    if (!commandPublisher.publish(DeviceCommand.captureRequest(deviceId, artifactName))) {
      Instant failedAt = clock.instant();
      wake.fail(FailureCode.PUBLISH_FAILED.code(), failedAt);
      wakeDao.update(wake);
      failureReporter.report(new TransferFailure(deviceId, artifactName, null, FailureCode.PUBLISH_FAILED,
          "Запрос снимка не отправлен", failedAt));
      return;
    }
    wake.transitionTo(ProtocolState.SNAP_SENT, clock.instant());
    wakeDao.update(wake);
  }

  private void supersedeOpenWake(String deviceId, Instant now) {
    Optional<WakeEvent> open = wakeDao.findOpenByDevice(deviceId);
    if (open.isPresent()) {
      WakeEvent previous = open.get();
      logger.warn("⚠️ Новое пробуждение {}: незавершённое пробуждение {} ({}) закрыто",
          deviceId, previous.getId(), previous.getState());
      previous.fail(SUPERSEDED, now);
      wakeDao.update(previous);
    }
  }

  private void handleMetadata(MetadataMessage metadata) {
    String deviceId = metadata.getDeviceId();
    Instant now = clock.instant();
    deviceDao.recordSeen(deviceId, now);
    if (!metadata.getReadings().isEmpty()) {
      telemetryDao.saveTelemetry(deviceId, metadata.getCapturedAt(), metadata.getReadings(), null, null);
    }
    if (metadata.getErrorCode() != null && metadata.getErrorCode() != 0) {
      logger.warn("⚠️ Устройство {} сообщило код ошибки камеры {}", deviceId, metadata.getErrorCode());
    }

    Optional<WakeEvent> open = wakeDao.findOpenByDevice(deviceId);
    if (open.isEmpty()) {
      logger.warn("⚠️ Метаданные {} от {} без открытого пробуждения, отброшены",
          metadata.getArtifactName(), deviceId);
      return;
    }
    WakeEvent wake = open.get();
    if (wake.getArtifactName() != null && !wake.getArtifactName().equals(metadata.getArtifactName())) {
      logger.warn("⚠️ Устройство {} прислало снимок {} вместо запрошенного {}",
          deviceId, metadata.getArtifactName(), wake.getArtifactName());
    }

    ImageTransfer transfer = transferDao.insertIfAbsent(ImageTransfer.receiving(deviceId,
        metadata.getArtifactName(), metadata.getTotalFragments(), metadata.getCapturedAt(), now));

    if (transfer.getStatus() == TransferStatus.COMPLETE) {
      logger.info("Метаданные для уже завершённого снимка {} проигнорированы", transfer.key());
      return;
    }
    if (transfer.getStatus() == TransferStatus.FAILED) {
      logger.info("🔁 Повторная передача снимка {} после сбоя {}", transfer.key(), transfer.getFailureCode());
      transfer.reopen(now);
      transferDao.update(transfer);
    } else if (transfer.getTotalFragments() != metadata.getTotalFragments()) {
      logger.warn("⚠️ Снимок {}: объявлено {} фрагментов, ранее {}. Оставляем прежнее значение",
          transfer.key(), metadata.getTotalFragments(), transfer.getTotalFragments());
    }

    wake.setTransferId(transfer.getId());
    if (wake.getArtifactName() == null) {
      wake.setArtifactName(transfer.getArtifactName());
    }
    if (wake.getState() == ProtocolState.SNAP_SENT) {
      wake.transitionTo(ProtocolState.METADATA_RECEIVED, now);
    }
    wakeDao.update(wake);
    logger.info("📋 Метаданные {}: {} фрагментов", transfer.key(), transfer.getTotalFragments());

    // Фрагменты могли прийти раньше метаданных
    ArtifactKey key = transfer.key();
    int total = transfer.getTotalFragments();
    transfer.setReceivedFragments(chunkStore.receivedCount(key, total));
    transfer.touch(now);
    transferDao.update(transfer);
    if (chunkStore.isComplete(key, total)) {
      finalizer.finalizeTransfer(key);
    } else if (chunkStore.isPresent(key, transfer.getAwaitedTailIndex()) || onlyTailMissing(transfer)) {
      requestMissing(transfer, now);
    }
  }

  private void handleFragment(FragmentMessage fragment) {
    String deviceId = fragment.getDeviceId();
    ArtifactKey key = new ArtifactKey(deviceId, fragment.getArtifactName());
    Instant now = clock.instant();
    deviceDao.recordSeen(deviceId, now);

    Optional<ImageTransfer> known = transferDao.find(key);
    if (known.isPresent() && !known.get().isReceiving()) {
      logger.debug("Фрагмент {} для {} в статусе {} проигнорирован",
          fragment.getIndex(), key, known.get().getStatus());
      return;
    }

    if (fragment.getIndex() == 0 && !hasJpegHeader(fragment.getBytes())) {
      logger.warn("⚠️ Первый фрагмент {} не начинается с заголовка JPEG", key);
    }
    boolean stored = chunkStore.storeFragment(deviceId, fragment.getArtifactName(), fragment.getIndex(),
        fragment.getBytes());

    if (known.isEmpty()) {
      logger.debug("Фрагмент {} для {} сохранён до прихода метаданных", fragment.getIndex(), key);
      return;
    }
    ImageTransfer transfer = known.get();
    int total = transfer.getTotalFragments();
    if (stored) {
      transfer.setReceivedFragments(chunkStore.receivedCount(key, total));
      transfer.touch(now);
      transferDao.update(transfer);
    }

    if (chunkStore.isComplete(key, total)) {
      finalizer.finalizeTransfer(key);
    } else if (stored && (fragment.getIndex() == transfer.getAwaitedTailIndex() || onlyTailMissing(transfer))) {
      requestMissing(transfer, now);
    }
  }

  /**
   * Получены все фрагменты, кроме ожидаемого последнего: он сам мог потеряться.
   */
  private boolean onlyTailMissing(ImageTransfer transfer) {
    return transfer.getReceivedFragments() > 0
        && transfer.getReceivedFragments() == transfer.getTotalFragments() - 1
        && !chunkStore.isPresent(transfer.key(), transfer.getAwaitedTailIndex());
  }

  private void requestMissing(ImageTransfer transfer, Instant now) {
    List<Integer> missing = chunkStore.missingIndices(transfer.key(), transfer.getTotalFragments());
    if (missing.isEmpty()) {
      return;
    }
    logger.info("🧩 Снимок {}: запрос недостающих фрагментов {}", transfer.key(), missing);
    if (!commandPublisher.publish(
        DeviceCommand.missingFragments(transfer.getDeviceId(), transfer.getArtifactName(), missing))) {
      logger.error("❌ Запрос недостающих фрагментов для {} не отправлен", transfer.key());
    }
    transfer.setAwaitedTailIndex(missing.get(missing.size() - 1));
    transfer.setMissingRequests(transfer.getMissingRequests() + 1);
    transfer.setLastRequestAt(now);
    transferDao.update(transfer);
  }

  private void handleTelemetry(TelemetryMessage telemetry) {
    Instant now = clock.instant();
    deviceDao.recordSeen(telemetry.getDeviceId(), now);
    telemetryDao.saveTelemetry(telemetry.getDeviceId(), telemetry.getCapturedAt(), telemetry.getReadings(),
        telemetry.getBatteryVoltage(), telemetry.getWifiRssi());
    logger.info("🌡️ Телеметрия от {} сохранена", telemetry.getDeviceId());
  }

  private static boolean hasJpegHeader(byte[] bytes) {
    return bytes.length >= 2 && bytes[0] == JPEG_SOI_1 && bytes[1] == JPEG_SOI_2;
  }

  private static String artifactNameOf(InboundMessage message) {
    if (message instanceof MetadataMessage) {
      return ((MetadataMessage) message).getArtifactName();
    }
    if (message instanceof FragmentMessage) {
      return ((FragmentMessage) message).getArtifactName();
    }
    return null;
  }
}
