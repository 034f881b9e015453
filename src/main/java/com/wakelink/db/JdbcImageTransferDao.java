package com.wakelink.db;

import com.wakelink.model.ArtifactKey;
import com.wakelink.model.ImageTransfer;
import com.wakelink.model.TransferStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DAO-класс для таблицы image_transfers.
 */
public class JdbcImageTransferDao implements ImageTransferDao {

  private static final String COLUMNS = "transfer_id, device_mac, artifact_name, total_fragments, received_fragments, "
      + "status, storage_location, failure_code, retry_count, awaited_tail_index, missing_requests, "
      + "captured_at, created_at, last_activity_at, completed_at, last_request_at";

  private final DatabaseConnection database;

  public JdbcImageTransferDao(DatabaseConnection database) {
    this.database = database;
  }

  @Override
  public Optional<ImageTransfer> find(ArtifactKey key) {
    String sql = "SELECT " + COLUMNS + " FROM image_transfers WHERE device_mac = ? AND artifact_name = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, key.getDeviceId());
      pstmt.setString(2, key.getArtifactName());
      try (ResultSet rs = pstmt.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось прочитать передачу " + key, e);
    }
  }

  @Override
  public Optional<ImageTransfer> findById(long transferId) {
    String sql = "SELECT " + COLUMNS + " FROM image_transfers WHERE transfer_id = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setLong(1, transferId);
      try (ResultSet rs = pstmt.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось прочитать передачу " + transferId, e);
    }
  }

  @Override
  public ImageTransfer insertIfAbsent(ImageTransfer transfer) {
    String sql = "INSERT INTO image_transfers (device_mac, artifact_name, total_fragments, received_fragments, status, "
        + "retry_count, awaited_tail_index, missing_requests, captured_at, created_at, last_activity_at) "
        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT (device_mac, artifact_name) DO NOTHING";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, transfer.getDeviceId());
      pstmt.setString(2, transfer.getArtifactName());
      pstmt.setInt(3, transfer.getTotalFragments());
      pstmt.setInt(4, transfer.getReceivedFragments());
      pstmt.setString(5, transfer.getStatus().dbValue());
      pstmt.setInt(6, transfer.getRetryCount());
      pstmt.setInt(7, transfer.getAwaitedTailIndex());
      pstmt.setInt(8, transfer.getMissingRequests());
      SqlTypes.setInstant(pstmt, 9, transfer.getCapturedAt());
      SqlTypes.setInstant(pstmt, 10, transfer.getCreatedAt());
      SqlTypes.setInstant(pstmt, 11, transfer.getLastActivityAt());
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось создать передачу " + transfer.key(), e);
    }
    return find(transfer.key())
        .orElseThrow(() -> new IllegalStateException("Передача " + transfer.key() + " не найдена после вставки"));
  }

  @Override
  public void update(ImageTransfer transfer) {
    String sql = "UPDATE image_transfers SET total_fragments = ?, received_fragments = ?, status = ?, "
        + "storage_location = ?, failure_code = ?, retry_count = ?, awaited_tail_index = ?, missing_requests = ?, "
        + "last_activity_at = ?, completed_at = ?, last_request_at = ? WHERE transfer_id = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setInt(1, transfer.getTotalFragments());
      pstmt.setInt(2, transfer.getReceivedFragments());
      pstmt.setString(3, transfer.getStatus().dbValue());
      pstmt.setString(4, transfer.getStorageLocation());
      pstmt.setString(5, transfer.getFailureCode());
      pstmt.setInt(6, transfer.getRetryCount());
      pstmt.setInt(7, transfer.getAwaitedTailIndex());
      pstmt.setInt(8, transfer.getMissingRequests());
      SqlTypes.setInstant(pstmt, 9, transfer.getLastActivityAt());
      SqlTypes.setInstant(pstmt, 10, transfer.getCompletedAt());
      SqlTypes.setInstant(pstmt, 11, transfer.getLastRequestAt());
      pstmt.setLong(12, transfer.getId());
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось обновить передачу " + transfer.key(), e);
    }
  }

  @Override
  public boolean markFailedIfReceiving(long transferId, String failureCode, Instant now) {
    String sql = "UPDATE image_transfers SET status = ?, failure_code = ?, last_activity_at = ? "
        + "WHERE transfer_id = ? AND status = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, TransferStatus.FAILED.dbValue());
      pstmt.setString(2, failureCode);
      SqlTypes.setInstant(pstmt, 3, now);
      pstmt.setLong(4, transferId);
      pstmt.setString(5, TransferStatus.RECEIVING.dbValue());
      return pstmt.executeUpdate() == 1;
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось перевести передачу " + transferId + " в failed", e);
    }
  }

  @Override
  public List<ImageTransfer> findStaleReceiving(Instant cutoff) {
    String sql = "SELECT " + COLUMNS + " FROM image_transfers WHERE status = ? AND last_activity_at < ?";
    List<ImageTransfer> transfers = new ArrayList<>();
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, TransferStatus.RECEIVING.dbValue());
      SqlTypes.setInstant(pstmt, 2, cutoff);
      try (ResultSet rs = pstmt.executeQuery()) {
        while (rs.next()) {
          transfers.add(map(rs));
        }
      }
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось найти зависшие передачи", e);
    }
    return transfers;
  }

  private static ImageTransfer map(ResultSet rs) throws SQLException {
    ImageTransfer transfer = new ImageTransfer();
    transfer.setId(rs.getLong("transfer_id"));
    transfer.setDeviceId(rs.getString("device_mac"));
    transfer.setArtifactName(rs.getString("artifact_name"));
    transfer.setTotalFragments(rs.getInt("total_fragments"));
    transfer.setReceivedFragments(rs.getInt("received_fragments"));
    transfer.setStatus(TransferStatus.fromDbValue(rs.getString("status")));
    transfer.setStorageLocation(rs.getString("storage_location"));
    transfer.setFailureCode(rs.getString("failure_code"));
    transfer.setRetryCount(rs.getInt("retry_count"));
    transfer.setAwaitedTailIndex(rs.getInt("awaited_tail_index"));
    transfer.setMissingRequests(rs.getInt("missing_requests"));
    transfer.setCapturedAt(SqlTypes.getInstant(rs, "captured_at"));
    transfer.setCreatedAt(SqlTypes.getInstant(rs, "created_at"));
    transfer.setLastActivityAt(SqlTypes.getInstant(rs, "last_activity_at"));
    transfer.setCompletedAt(SqlTypes.getInstant(rs, "completed_at"));
    transfer.setLastRequestAt(SqlTypes.getInstant(rs, "last_request_at"));
    return transfer;
  }
}
