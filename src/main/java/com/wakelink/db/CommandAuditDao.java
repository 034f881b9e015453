package com.wakelink.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Журнал исходящих команд устройствам (таблица device_commands).
 */
public class CommandAuditDao {

  private final DatabaseConnection database;

  public CommandAuditDao(DatabaseConnection database) {
    this.database = database;
  }

  /**
   * Записывает попытку отправки команды, успешную или нет.
   */
  public void record(String deviceId, String commandKind, String topic, String payload,
                     boolean success, String errorMessage, Instant sentAt) {
    String sql = "INSERT INTO device_commands (device_mac, command_kind, topic, payload, success, error_message, sent_at) "
        + "VALUES (?, ?, ?, ?, ?, ?, ?)";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceId);
      pstmt.setString(2, commandKind);
      pstmt.setString(3, topic);
      pstmt.setString(4, payload);
      pstmt.setBoolean(5, success);
      pstmt.setString(6, errorMessage);
      SqlTypes.setInstant(pstmt, 7, sentAt);
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось записать команду " + commandKind + " для устройства " + deviceId, e);
    }
  }
}
