package com.wakelink.db;

import com.wakelink.message.SensorReadings;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;

/**
 * DAO-класс для операций с таблицей device_telemetry.
 * Отвечает за сохранение телеметрии в базу данных.
 */
public class TelemetryDao {

  private final DatabaseConnection database;

  public TelemetryDao(DatabaseConnection database) {
    this.database = database;
  }

  /**
   * Сохраняет телеметрию в таблицу device_telemetry.
   * @param deviceId Идентификатор устройства.
   * @param capturedAt Время измерения.
   * @param readings Показания датчиков.
   * @param batteryVoltage Напряжение батареи (может быть null).
   * @param wifiRssi Уровень сигнала Wi-Fi (может быть null).
   * @throws DataAccessException в случае ошибки.
   */
  public void saveTelemetry(String deviceId, Instant capturedAt, SensorReadings readings,
                            Double batteryVoltage, Integer wifiRssi) {
    String sql = "INSERT INTO device_telemetry (device_mac, captured_at, temperature, humidity, pressure, "
        + "gas_resistance, battery_voltage, wifi_rssi) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceId);
      SqlTypes.setInstant(pstmt, 2, capturedAt);
      SqlTypes.setDouble(pstmt, 3, readings.getTemperature());
      SqlTypes.setDouble(pstmt, 4, readings.getHumidity());
      SqlTypes.setDouble(pstmt, 5, readings.getPressure());
      SqlTypes.setDouble(pstmt, 6, readings.getGasResistance());
      SqlTypes.setDouble(pstmt, 7, batteryVoltage);
      SqlTypes.setInteger(pstmt, 8, wifiRssi);
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось сохранить телеметрию в базу данных. " +
          "Устройство: " + deviceId + ", Температура: " + readings.getTemperature() +
          ", Влажность: " + readings.getHumidity(), e);
    }
  }
}
