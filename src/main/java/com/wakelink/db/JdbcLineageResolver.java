package com.wakelink.db;

import com.wakelink.lineage.DeviceLineage;
import com.wakelink.lineage.LineageResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Разрешение цепочки владения по таблицам devices и sites.
 */
public class JdbcLineageResolver implements LineageResolver {

  private static final Logger logger = LoggerFactory.getLogger(JdbcLineageResolver.class);

  private final DatabaseConnection database;

  public JdbcLineageResolver(DatabaseConnection database) {
    this.database = database;
  }

  @Override
  public Optional<DeviceLineage> resolve(String deviceId) {
    String sql = "SELECT d.device_mac, d.site_id, d.provisioning_status, d.is_active, d.wake_schedule_cron, "
        + "s.program_id, s.company_id, s.timezone, s.wake_schedule_cron AS site_schedule "
        + "FROM devices d LEFT JOIN sites s ON s.site_id = d.site_id WHERE d.device_mac = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceId);
      try (ResultSet rs = pstmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new DeviceLineage(
            rs.getString("device_mac"),
            rs.getString("site_id"),
            rs.getString("program_id"),
            rs.getString("company_id"),
            parseZone(deviceId, rs.getString("timezone")),
            rs.getString("wake_schedule_cron"),
            rs.getString("site_schedule"),
            rs.getString("provisioning_status"),
            rs.getBoolean("is_active")));
      }
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось разрешить цепочку владения устройства " + deviceId, e);
    }
  }

  private static ZoneId parseZone(String deviceId, String zone) {
    if (zone == null) {
      return null;
    }
    try {
      return ZoneId.of(zone);
    } catch (DateTimeException e) {
      logger.warn("⚠️ Некорректный часовой пояс площадки '{}' для устройства {}, используется пояс по умолчанию",
          zone, deviceId);
      return null;
    }
  }
}
