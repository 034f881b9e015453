package com.wakelink.service;

import com.wakelink.command.CommandPublisher;
import com.wakelink.command.HttpCommandPublisher;
import com.wakelink.config.Config;
import com.wakelink.db.CommandAuditDao;
import com.wakelink.db.DatabaseConnection;
import com.wakelink.db.DeviceDao;
import com.wakelink.db.ImageTransferDao;
import com.wakelink.db.JdbcDeviceDao;
import com.wakelink.db.JdbcFragmentDao;
import com.wakelink.db.JdbcImageTransferDao;
import com.wakelink.db.JdbcLineageResolver;
import com.wakelink.db.JdbcWakeEventDao;
import com.wakelink.db.TelemetryDao;
import com.wakelink.db.WakeEventDao;
import com.wakelink.external.HttpArtifactStorage;
import com.wakelink.external.HttpDownstreamNotifier;
import com.wakelink.lineage.LineageResolver;
import com.wakelink.message.MessageParser;
import com.wakelink.schedule.WakeSchedule;
import com.wakelink.schedule.WakeScheduleCalculator;
import com.wakelink.store.ChunkStore;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Сборка движка протокола из конфигурации: DAO, хранилище фрагментов,
 * внешние сервисы, маршрутизатор и фоновая очистка.
 */
public class WakeEngine {

  private final ProtocolRouter router;
  private final TransferSweeper sweeper;

  public WakeEngine(ProtocolRouter router, TransferSweeper sweeper) {
    this.router = router;
    this.sweeper = sweeper;
  }

  /**
   * Создаёт движок по параметрам application.properties.
   */
  public static WakeEngine fromConfig(DatabaseConnection database, Clock clock) {
    Duration timeout = Config.getSeconds("http.timeout.seconds", 10);
    Duration ttl = Config.getMinutes("fragment.ttl.minutes", 30);
    Duration sweepInterval = Config.getSeconds("sweep.interval.seconds", 60);

    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .build();

    WakeEventDao wakeDao = new JdbcWakeEventDao(database);
    ImageTransferDao transferDao = new JdbcImageTransferDao(database);
    DeviceDao deviceDao = new JdbcDeviceDao(database);
    LineageResolver lineageResolver = new JdbcLineageResolver(database);
    ChunkStore chunkStore = new ChunkStore(new JdbcFragmentDao(database), ttl, clock);

    WakeScheduleCalculator calculator = new WakeScheduleCalculator(
        WakeSchedule.singleHour(Config.getInt("schedule.default.hour", 8)),
        ZoneId.of(Config.getProperty("schedule.default.timezone", "UTC")));

    CommandPublisher publisher = new HttpCommandPublisher(httpClient,
        Config.getRequiredProperty("broker.bridge.url"), timeout, new CommandAuditDao(database), clock);
    HttpArtifactStorage storage = new HttpArtifactStorage(httpClient,
        Config.getRequiredProperty("storage.base.url"), Config.getProperty("storage.bucket", "device-images"),
        timeout);
    HttpDownstreamNotifier notifier = new HttpDownstreamNotifier(httpClient,
        Config.getRequiredProperty("downstream.completion.url"),
        Config.getRequiredProperty("downstream.failure.url"), timeout);

    Finalizer finalizer = new Finalizer(chunkStore, transferDao, wakeDao, deviceDao, lineageResolver, storage,
        notifier, notifier, calculator, publisher, clock);
    ProtocolRouter router = new ProtocolRouter(new MessageParser(clock), wakeDao, transferDao, deviceDao,
        new TelemetryDao(database), lineageResolver, chunkStore, calculator, publisher, finalizer, notifier, clock);
    TransferSweeper sweeper = new TransferSweeper(chunkStore, transferDao, wakeDao, publisher, notifier, clock,
        sweepInterval);
    return new WakeEngine(router, sweeper);
  }

  public WakeProtocolService getService() {
    return router;
  }

  public TransferSweeper getSweeper() {
    return sweeper;
  }
}
