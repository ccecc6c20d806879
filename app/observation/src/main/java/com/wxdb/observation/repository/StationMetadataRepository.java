/*
 * どこで: Observation データアクセス
 * 何を: tbl_metadata の upsert と参照を行う
 * なぜ: 取り込みを繰り返しても観測点ごとに 1 行へ収束させるため
 */
package com.wxdb.observation.repository;

import static com.wxdb.common.JdbcTimestampUtils.toInstant;
import static com.wxdb.common.JdbcTimestampUtils.toTimestamp;

import com.wxdb.observation.model.StationMetadataRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class StationMetadataRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int upsert(StationMetadataRecord record) {
    final String sql =
        """
        INSERT INTO tbl_metadata (
          primary_id,
          station_name,
          latitude,
          longitude,
          elevation,
          primary_provider,
          reported_lat,
          reported_long,
          source,
          state,
          timezone,
          updated_at
        ) VALUES (
          :primaryId,
          :stationName,
          :latitude,
          :longitude,
          :elevation,
          :primaryProvider,
          :reportedLat,
          :reportedLong,
          :source,
          :state,
          :timezone,
          :updatedAt
        )
        ON CONFLICT (primary_id)
        DO UPDATE SET
          station_name = EXCLUDED.station_name,
          latitude = EXCLUDED.latitude,
          longitude = EXCLUDED.longitude,
          elevation = EXCLUDED.elevation,
          primary_provider = EXCLUDED.primary_provider,
          reported_lat = EXCLUDED.reported_lat,
          reported_long = EXCLUDED.reported_long,
          source = EXCLUDED.source,
          state = EXCLUDED.state,
          timezone = EXCLUDED.timezone,
          updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("primaryId", record.primaryId())
            .addValue("stationName", record.stationName())
            .addValue("latitude", record.latitude())
            .addValue("longitude", record.longitude())
            .addValue("elevation", record.elevation())
            .addValue("primaryProvider", record.primaryProvider())
            .addValue("reportedLat", record.reportedLat())
            .addValue("reportedLong", record.reportedLong())
            .addValue("source", record.source())
            .addValue("state", record.state())
            .addValue("timezone", record.timezone())
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<StationMetadataRecord> findByPrimaryId(String primaryId) {
    final String sql =
        """
        SELECT primary_id, station_name, latitude, longitude, elevation, primary_provider,
               reported_lat, reported_long, source, state, timezone, updated_at
        FROM tbl_metadata
        WHERE primary_id = :primaryId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("primaryId", primaryId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private StationMetadataRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new StationMetadataRecord(
        rs.getString("primary_id"),
        rs.getString("station_name"),
        rs.getBigDecimal("latitude"),
        rs.getBigDecimal("longitude"),
        rs.getBigDecimal("elevation"),
        rs.getString("primary_provider"),
        rs.getBigDecimal("reported_lat"),
        rs.getBigDecimal("reported_long"),
        rs.getString("source"),
        rs.getString("state"),
        rs.getString("timezone"),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
