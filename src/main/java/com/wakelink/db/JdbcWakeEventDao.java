package com.wakelink.db;

import com.wakelink.model.WakeEvent;
import com.wakelink.protocol.ProtocolState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DAO-класс для таблицы wake_events.
 */
public class JdbcWakeEventDao implements WakeEventDao {

  private static final String COLUMNS = "wake_id, device_mac, transfer_id, protocol_state, artifact_name, "
      + "pending_count, hello_at, ack_sent_at, snap_sent_at, sleep_sent_at, next_wake_at, is_complete, "
      + "failure_reason, images_requested, images_completed, updated_at";

  private final DatabaseConnection database;

  public JdbcWakeEventDao(DatabaseConnection database) {
    this.database = database;
  }

  @Override
  public WakeEvent insert(WakeEvent wake) {
    String sql = "INSERT INTO wake_events (device_mac, transfer_id, protocol_state, artifact_name, pending_count, "
        + "hello_at, ack_sent_at, snap_sent_at, sleep_sent_at, next_wake_at, is_complete, failure_reason, "
        + "images_requested, images_completed, updated_at) "
        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING wake_id";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, wake.getDeviceId());
      SqlTypes.setLong(pstmt, 2, wake.getTransferId());
      pstmt.setString(3, wake.getState().dbValue());
      pstmt.setString(4, wake.getArtifactName());
      pstmt.setInt(5, wake.getPendingCount());
      SqlTypes.setInstant(pstmt, 6, wake.getHelloAt());
      SqlTypes.setInstant(pstmt, 7, wake.getAckSentAt());
      SqlTypes.setInstant(pstmt, 8, wake.getSnapSentAt());
      SqlTypes.setInstant(pstmt, 9, wake.getSleepSentAt());
      SqlTypes.setInstant(pstmt, 10, wake.getNextWakeAt());
      pstmt.setBoolean(11, wake.isComplete());
      pstmt.setString(12, wake.getFailureReason());
      pstmt.setInt(13, wake.getImagesRequested());
      pstmt.setInt(14, wake.getImagesCompleted());
      SqlTypes.setInstant(pstmt, 15, wake.getUpdatedAt());
      try (ResultSet rs = pstmt.executeQuery()) {
        rs.next();
        wake.setId(rs.getLong(1));
      }
      return wake;
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось сохранить пробуждение устройства " + wake.getDeviceId(), e);
    }
  }

  @Override
  public void update(WakeEvent wake) {
    String sql = "UPDATE wake_events SET transfer_id = ?, protocol_state = ?, artifact_name = ?, "
        + "ack_sent_at = ?, snap_sent_at = ?, sleep_sent_at = ?, next_wake_at = ?, is_complete = ?, "
        + "failure_reason = ?, images_requested = ?, images_completed = ?, updated_at = ? WHERE wake_id = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      SqlTypes.setLong(pstmt, 1, wake.getTransferId());
      pstmt.setString(2, wake.getState().dbValue());
      pstmt.setString(3, wake.getArtifactName());
      SqlTypes.setInstant(pstmt, 4, wake.getAckSentAt());
      SqlTypes.setInstant(pstmt, 5, wake.getSnapSentAt());
      SqlTypes.setInstant(pstmt, 6, wake.getSleepSentAt());
      SqlTypes.setInstant(pstmt, 7, wake.getNextWakeAt());
      pstmt.setBoolean(8, wake.isComplete());
      pstmt.setString(9, wake.getFailureReason());
      pstmt.setInt(10, wake.getImagesRequested());
      pstmt.setInt(11, wake.getImagesCompleted());
      SqlTypes.setInstant(pstmt, 12, wake.getUpdatedAt());
      pstmt.setLong(13, wake.getId());
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось обновить пробуждение " + wake.getId(), e);
    }
  }

  @Override
  public Optional<WakeEvent> findById(long wakeId) {
    return queryOne("SELECT " + COLUMNS + " FROM wake_events WHERE wake_id = ?", wakeId);
  }

  @Override
  public Optional<WakeEvent> findOpenByDevice(String deviceId) {
    String sql = "SELECT " + COLUMNS + " FROM wake_events WHERE device_mac = ? AND protocol_state IN (?, ?, ?) "
        + "ORDER BY wake_id DESC LIMIT 1";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceId);
      pstmt.setString(2, ProtocolState.ACK_SENT.dbValue());
      pstmt.setString(3, ProtocolState.SNAP_SENT.dbValue());
      pstmt.setString(4, ProtocolState.METADATA_RECEIVED.dbValue());
      try (ResultSet rs = pstmt.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось найти открытое пробуждение устройства " + deviceId, e);
    }
  }

  @Override
  public Optional<WakeEvent> findLatestByTransfer(long transferId) {
    return queryOne("SELECT " + COLUMNS + " FROM wake_events WHERE transfer_id = ? ORDER BY wake_id DESC LIMIT 1",
        transferId);
  }

  @Override
  public List<WakeEvent> findByDevice(String deviceId) {
    String sql = "SELECT " + COLUMNS + " FROM wake_events WHERE device_mac = ? ORDER BY wake_id";
    List<WakeEvent> wakes = new ArrayList<>();
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceId);
      try (ResultSet rs = pstmt.executeQuery()) {
        while (rs.next()) {
          wakes.add(map(rs));
        }
      }
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось прочитать пробуждения устройства " + deviceId, e);
    }
    return wakes;
  }

  private Optional<WakeEvent> queryOne(String sql, long id) {
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setLong(1, id);
      try (ResultSet rs = pstmt.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось прочитать пробуждение по ключу " + id, e);
    }
  }

  private static WakeEvent map(ResultSet rs) throws SQLException {
    WakeEvent wake = new WakeEvent();
    wake.setId(rs.getLong("wake_id"));
    wake.setDeviceId(rs.getString("device_mac"));
    wake.setTransferId(SqlTypes.getLong(rs, "transfer_id"));
    wake.restoreState(ProtocolState.fromDbValue(rs.getString("protocol_state")));
    wake.setArtifactName(rs.getString("artifact_name"));
    wake.setPendingCount(rs.getInt("pending_count"));
    wake.setHelloAt(SqlTypes.getInstant(rs, "hello_at"));
    wake.setAckSentAt(SqlTypes.getInstant(rs, "ack_sent_at"));
    wake.setSnapSentAt(SqlTypes.getInstant(rs, "snap_sent_at"));
    wake.setSleepSentAt(SqlTypes.getInstant(rs, "sleep_sent_at"));
    wake.setNextWakeAt(SqlTypes.getInstant(rs, "next_wake_at"));
    wake.setComplete(rs.getBoolean("is_complete"));
    wake.setFailureReason(rs.getString("failure_reason"));
    wake.setImagesRequested(rs.getInt("images_requested"));
    wake.setImagesCompleted(rs.getInt("images_completed"));
    wake.setUpdatedAt(SqlTypes.getInstant(rs, "updated_at"));
    return wake;
  }
}
