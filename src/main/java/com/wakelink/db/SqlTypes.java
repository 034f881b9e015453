package com.wakelink.db;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

/**
 * Преобразования nullable-значений между JDBC и java.time.
 */
final class SqlTypes {

  static void setInstant(PreparedStatement pstmt, int index, Instant value) throws SQLException {
    if (value == null) {
      pstmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
    } else {
      pstmt.setTimestamp(index, Timestamp.from(value));
    }
  }

  static Instant getInstant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts != null ? ts.toInstant() : null;
  }

  static void setLong(PreparedStatement pstmt, int index, Long value) throws SQLException {
    if (value == null) {
      pstmt.setNull(index, Types.BIGINT);
    } else {
      pstmt.setLong(index, value);
    }
  }

  static Long getLong(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }

  static void setInteger(PreparedStatement pstmt, int index, Integer value) throws SQLException {
    if (value == null) {
      pstmt.setNull(index, Types.INTEGER);
    } else {
      pstmt.setInt(index, value);
    }
  }

  static void setDouble(PreparedStatement pstmt, int index, Double value) throws SQLException {
    if (value == null) {
      pstmt.setNull(index, Types.DOUBLE);
    } else {
      pstmt.setDouble(index, value);
    }
  }

  private SqlTypes() {
  }
}
