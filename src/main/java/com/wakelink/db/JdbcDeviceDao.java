package com.wakelink.db;

import com.wakelink.message.AliveMessage;
import com.wakelink.model.DeviceScheduleState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * DAO-класс для таблицы devices.
 */
public class JdbcDeviceDao implements DeviceDao {

  private final DatabaseConnection database;

  public JdbcDeviceDao(DatabaseConnection database) {
    this.database = database;
  }

  @Override
  public void recordHello(AliveMessage hello, Instant seenAt) {
    String sql = "UPDATE devices SET last_seen_at = ?, is_active = TRUE, "
        + "battery_voltage = COALESCE(?, battery_voltage), "
        + "battery_health_percent = COALESCE(?, battery_health_percent), "
        + "wifi_rssi = COALESCE(?, wifi_rssi), "
        + "firmware_version = COALESCE(?, firmware_version), "
        + "hardware_version = COALESCE(?, hardware_version) "
        + "WHERE device_mac = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      SqlTypes.setInstant(pstmt, 1, seenAt);
      SqlTypes.setDouble(pstmt, 2, hello.getBatteryVoltage());
      SqlTypes.setInteger(pstmt, 3, hello.getBatteryHealthPercent());
      SqlTypes.setInteger(pstmt, 4, hello.getWifiRssi());
      pstmt.setString(5, hello.getFirmwareVersion());
      pstmt.setString(6, hello.getHardwareVersion());
      pstmt.setString(7, hello.getDeviceId());
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось обновить устройство " + hello.getDeviceId(), e);
    }
  }

  @Override
  public void recordSeen(String deviceId, Instant seenAt) {
    String sql = "UPDATE devices SET last_seen_at = GREATEST(COALESCE(last_seen_at, ?), ?) WHERE device_mac = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      SqlTypes.setInstant(pstmt, 1, seenAt);
      SqlTypes.setInstant(pstmt, 2, seenAt);
      pstmt.setString(3, deviceId);
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось обновить last_seen устройства " + deviceId, e);
    }
  }

  @Override
  public boolean commitSchedule(String deviceId, Instant lastWakeAt, Instant nextWakeAt) {
    String sql = "UPDATE devices SET last_wake_at = ?, next_wake_at = ? "
        + "WHERE device_mac = ? "
        + "AND (last_wake_at IS NULL OR last_wake_at <= ?) "
        + "AND (next_wake_at IS NULL OR next_wake_at <= ?)";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      SqlTypes.setInstant(pstmt, 1, lastWakeAt);
      SqlTypes.setInstant(pstmt, 2, nextWakeAt);
      pstmt.setString(3, deviceId);
      SqlTypes.setInstant(pstmt, 4, lastWakeAt);
      SqlTypes.setInstant(pstmt, 5, nextWakeAt);
      return pstmt.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось сохранить расписание устройства " + deviceId, e);
    }
  }

  @Override
  public Optional<DeviceScheduleState> findScheduleState(String deviceId) {
    String sql = "SELECT last_wake_at, next_wake_at FROM devices WHERE device_mac = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceId);
      try (ResultSet rs = pstmt.executeQuery()) {
        if (rs.next()) {
          return Optional.of(new DeviceScheduleState(
              deviceId,
              SqlTypes.getInstant(rs, "last_wake_at"),
              SqlTypes.getInstant(rs, "next_wake_at")));
        }
      }
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось прочитать расписание устройства " + deviceId, e);
    }
    return Optional.empty();
  }
}
