package com.wakelink.db;

import com.wakelink.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Класс для управления соединением с PostgreSQL и инициализации таблиц.
 * <p>
 * Экземпляр передаётся каждому DAO явно, глобального состояния нет.
 */
public class DatabaseConnection {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseConnection.class);

  private final String url;
  private final String user;
  private final String password;

  public DatabaseConnection(String url, String user, String password) {
    if (url == null || url.trim().isEmpty()) {
      throw new IllegalArgumentException("Параметр 'db.url' не задан");
    }
    if (user == null || user.trim().isEmpty()) {
      throw new IllegalArgumentException("Параметр 'db.user' не задан");
    }
    if (password == null) {
      throw new IllegalArgumentException("Параметр 'db.password' не задан");
    }
    this.url = url;
    this.user = user;
    this.password = password;
  }

  /**
   * Создаёт подключение по параметрам db.url, db.user, db.password.
   */
  public static DatabaseConnection fromConfig() {
    return new DatabaseConnection(
        Config.getRequiredProperty("db.url"),
        Config.getRequiredProperty("db.user"),
        Config.getProperty("db.password", ""));
  }

  /**
   * Создаёт новое соединение с базой данных.
   * @return Новое соединение с PostgreSQL.
   * @throws DataAccessException если подключение не удалось.
   */
  public Connection getConnection() {
    try {
      return DriverManager.getConnection(url, user, password);
    } catch (SQLException e) {
      throw new DataAccessException(
          "Не удалось подключиться к базе данных по адресу: " + url +
              ". Проверьте, что PostgreSQL запущен и параметры подключения верны.",
          e
      );
    }
  }

  /**
   * Инициализирует базу данных: создаёт таблицы, если они отсутствуют.
   * Вызывается при старте приложения.
   * @throws DataAccessException если не удалось создать таблицы.
   */
  public void initializeDatabase() {
    try (Connection conn = getConnection();
         Statement stmt = conn.createStatement()) {

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS sites (
              site_id VARCHAR(64) PRIMARY KEY,
              site_name VARCHAR(200) NOT NULL,
              program_id VARCHAR(64),
              company_id VARCHAR(64),
              timezone VARCHAR(64) NOT NULL DEFAULT 'UTC',
              wake_schedule_cron VARCHAR(100)
          );
          """);

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS devices (
              device_mac VARCHAR(64) PRIMARY KEY,
              site_id VARCHAR(64) REFERENCES sites(site_id),
              provisioning_status VARCHAR(32) NOT NULL DEFAULT 'pending_mapping',
              is_active BOOLEAN NOT NULL DEFAULT TRUE,
              wake_schedule_cron VARCHAR(100),
              last_wake_at TIMESTAMPTZ,
              next_wake_at TIMESTAMPTZ,
              last_seen_at TIMESTAMPTZ,
              battery_voltage DOUBLE PRECISION,
              battery_health_percent INTEGER,
              wifi_rssi INTEGER,
              firmware_version VARCHAR(64),
              hardware_version VARCHAR(64)
          );
          """);

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS device_telemetry (
              id BIGSERIAL PRIMARY KEY,
              device_mac VARCHAR(64) NOT NULL,
              captured_at TIMESTAMPTZ NOT NULL,
              temperature DOUBLE PRECISION,
              humidity DOUBLE PRECISION,
              pressure DOUBLE PRECISION,
              gas_resistance DOUBLE PRECISION,
              battery_voltage DOUBLE PRECISION,
              wifi_rssi INTEGER,
              recorded_at TIMESTAMPTZ DEFAULT NOW()
          );
          """);

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS image_transfers (
              transfer_id BIGSERIAL PRIMARY KEY,
              device_mac VARCHAR(64) NOT NULL,
              artifact_name VARCHAR(200) NOT NULL,
              total_fragments INTEGER NOT NULL,
              received_fragments INTEGER NOT NULL DEFAULT 0,
              status VARCHAR(16) NOT NULL,
              storage_location TEXT,
              failure_code VARCHAR(32),
              retry_count INTEGER NOT NULL DEFAULT 0,
              awaited_tail_index INTEGER NOT NULL,
              missing_requests INTEGER NOT NULL DEFAULT 0,
              captured_at TIMESTAMPTZ,
              created_at TIMESTAMPTZ NOT NULL,
              last_activity_at TIMESTAMPTZ NOT NULL,
              completed_at TIMESTAMPTZ,
              last_request_at TIMESTAMPTZ,
              UNIQUE (device_mac, artifact_name)
          );
          """);

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS wake_events (
              wake_id BIGSERIAL PRIMARY KEY,
              device_mac VARCHAR(64) NOT NULL,
              transfer_id BIGINT REFERENCES image_transfers(transfer_id),
              protocol_state VARCHAR(32) NOT NULL,
              artifact_name VARCHAR(200),
              pending_count INTEGER NOT NULL DEFAULT 0,
              hello_at TIMESTAMPTZ NOT NULL,
              ack_sent_at TIMESTAMPTZ,
              snap_sent_at TIMESTAMPTZ,
              sleep_sent_at TIMESTAMPTZ,
              next_wake_at TIMESTAMPTZ,
              is_complete BOOLEAN NOT NULL DEFAULT FALSE,
              failure_reason VARCHAR(64),
              images_requested INTEGER NOT NULL DEFAULT 0,
              images_completed INTEGER NOT NULL DEFAULT 0,
              updated_at TIMESTAMPTZ NOT NULL
          );
          """);

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS image_fragments (
              device_mac VARCHAR(64) NOT NULL,
              artifact_name VARCHAR(200) NOT NULL,
              fragment_index INTEGER NOT NULL,
              data BYTEA NOT NULL,
              stored_at TIMESTAMPTZ NOT NULL,
              expires_at TIMESTAMPTZ NOT NULL,
              PRIMARY KEY (device_mac, artifact_name, fragment_index)
          );
          """);

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS device_commands (
              id BIGSERIAL PRIMARY KEY,
              device_mac VARCHAR(64) NOT NULL,
              command_kind VARCHAR(32) NOT NULL,
              topic VARCHAR(200) NOT NULL,
              payload TEXT NOT NULL,
              success BOOLEAN NOT NULL,
              error_message TEXT,
              sent_at TIMESTAMPTZ NOT NULL
          );
          """);

      stmt.execute("ALTER TABLE image_transfers ADD COLUMN IF NOT EXISTS last_request_at TIMESTAMPTZ");
      stmt.execute("CREATE INDEX IF NOT EXISTS idx_image_fragments_expires ON image_fragments (expires_at)");
      stmt.execute("CREATE INDEX IF NOT EXISTS idx_wake_events_device ON wake_events (device_mac, wake_id)");

      logger.info("✅ Таблицы созданы или уже существуют.");

    } catch (SQLException e) {
      throw new DataAccessException("Не удалось инициализировать базу данных.", e);
    }
  }
}
