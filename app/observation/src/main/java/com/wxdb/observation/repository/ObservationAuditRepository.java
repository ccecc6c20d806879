/*
 * どこで: Observation データアクセス
 * 何を: tbl_level2_audit への追記と参照を行う
 * なぜ: 削除された計測値を後から追跡できるようにするため
 */
package com.wxdb.observation.repository;

import static com.wxdb.common.JdbcTimestampUtils.toInstant;
import static com.wxdb.common.JdbcTimestampUtils.toTimestamp;

import com.wxdb.observation.model.ObservationAuditRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ObservationAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(ObservationAuditRecord record) {
    final String sql =
        """
        INSERT INTO tbl_level2_audit (
          action,
          user_name,
          occurred_at,
          row_id,
          field_name,
          field_value
        ) VALUES (
          :action,
          :userName,
          :occurredAt,
          :rowId,
          :fieldName,
          :fieldValue
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("action", record.action())
            .addValue("userName", record.userName())
            .addValue("occurredAt", toTimestamp(record.occurredAt()))
            .addValue("rowId", record.rowId())
            .addValue("fieldName", record.fieldName())
            .addValue("fieldValue", record.fieldValue());
    return jdbcTemplate.update(sql, params);
  }

  public List<ObservationAuditRecord> findByRowId(long rowId) {
    final String sql =
        """
        SELECT audit_id, action, user_name, occurred_at, row_id, field_name, field_value
        FROM tbl_level2_audit
        WHERE row_id = :rowId
        ORDER BY audit_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("rowId", rowId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private ObservationAuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ObservationAuditRecord(
        rs.getLong("audit_id"),
        rs.getString("action"),
        rs.getString("user_name"),
        toInstant(rs.getTimestamp("occurred_at")),
        rs.getLong("row_id"),
        rs.getString("field_name"),
        rs.getBigDecimal("field_value"));
  }
}
