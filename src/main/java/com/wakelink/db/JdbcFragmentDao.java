package com.wakelink.db;

import com.wakelink.model.ArtifactKey;
import com.wakelink.model.FragmentRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * DAO-класс для таблицы image_fragments.
 * Дубликаты отбрасываются через ON CONFLICT DO NOTHING, блокировки не нужны.
 */
public class JdbcFragmentDao implements FragmentDao {

  private final DatabaseConnection database;

  public JdbcFragmentDao(DatabaseConnection database) {
    this.database = database;
  }

  @Override
  public boolean insertIfAbsent(FragmentRecord record) {
    String sql = "INSERT INTO image_fragments (device_mac, artifact_name, fragment_index, data, stored_at, expires_at) "
        + "VALUES (?, ?, ?, ?, ?, ?) ON CONFLICT (device_mac, artifact_name, fragment_index) DO NOTHING";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, record.getDeviceId());
      pstmt.setString(2, record.getArtifactName());
      pstmt.setInt(3, record.getIndex());
      pstmt.setBytes(4, record.getData());
      SqlTypes.setInstant(pstmt, 5, record.getStoredAt());
      SqlTypes.setInstant(pstmt, 6, record.getExpiresAt());
      return pstmt.executeUpdate() == 1;
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось сохранить фрагмент " + record.getIndex()
          + " снимка " + record.getArtifactName() + " устройства " + record.getDeviceId(), e);
    }
  }

  @Override
  public void extendExpiry(ArtifactKey key, Instant expiresAt) {
    String sql = "UPDATE image_fragments SET expires_at = ? WHERE device_mac = ? AND artifact_name = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      SqlTypes.setInstant(pstmt, 1, expiresAt);
      pstmt.setString(2, key.getDeviceId());
      pstmt.setString(3, key.getArtifactName());
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось продлить срок жизни фрагментов " + key, e);
    }
  }

  @Override
  public List<Integer> findIndices(ArtifactKey key) {
    String sql = "SELECT fragment_index FROM image_fragments WHERE device_mac = ? AND artifact_name = ? "
        + "ORDER BY fragment_index";
    List<Integer> indices = new ArrayList<>();
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, key.getDeviceId());
      pstmt.setString(2, key.getArtifactName());
      try (ResultSet rs = pstmt.executeQuery()) {
        while (rs.next()) {
          indices.add(rs.getInt("fragment_index"));
        }
      }
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось прочитать индексы фрагментов " + key, e);
    }
    return indices;
  }

  @Override
  public List<FragmentRecord> findAll(ArtifactKey key) {
    String sql = "SELECT fragment_index, data, stored_at, expires_at FROM image_fragments "
        + "WHERE device_mac = ? AND artifact_name = ? ORDER BY fragment_index";
    List<FragmentRecord> records = new ArrayList<>();
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, key.getDeviceId());
      pstmt.setString(2, key.getArtifactName());
      try (ResultSet rs = pstmt.executeQuery()) {
        while (rs.next()) {
          records.add(new FragmentRecord(
              key.getDeviceId(),
              key.getArtifactName(),
              rs.getInt("fragment_index"),
              rs.getBytes("data"),
              SqlTypes.getInstant(rs, "stored_at"),
              SqlTypes.getInstant(rs, "expires_at")));
        }
      }
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось прочитать фрагменты " + key, e);
    }
    return records;
  }

  @Override
  public int deleteAll(ArtifactKey key) {
    String sql = "DELETE FROM image_fragments WHERE device_mac = ? AND artifact_name = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, key.getDeviceId());
      pstmt.setString(2, key.getArtifactName());
      return pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось удалить фрагменты " + key, e);
    }
  }

  @Override
  public List<ArtifactKey> deleteExpired(Instant now) {
    String sql = "DELETE FROM image_fragments WHERE expires_at < ? RETURNING device_mac, artifact_name";
    Set<ArtifactKey> keys = new LinkedHashSet<>();
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      SqlTypes.setInstant(pstmt, 1, now);
      try (ResultSet rs = pstmt.executeQuery()) {
        while (rs.next()) {
          keys.add(new ArtifactKey(rs.getString("device_mac"), rs.getString("artifact_name")));
        }
      }
    } catch (SQLException e) {
      throw new DataAccessException("Не удалось удалить просроченные фрагменты", e);
    }
    return new ArrayList<>(keys);
  }
}
