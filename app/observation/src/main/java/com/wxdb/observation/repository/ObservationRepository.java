/*
 * どこで: Observation データアクセス
 * 何を: tbl_level2 の登録/参照/行ロック/削除を行う
 * なぜ: 削除前の行イメージをロックした状態で取得し、監査と削除を同一トランザクションに収めるため
 */
package com.wxdb.observation.repository;

import static com.wxdb.common.JdbcTimestampUtils.toInstant;
import static com.wxdb.common.JdbcTimestampUtils.toTimestamp;

import com.wxdb.observation.model.ObservationRecord;
import com.wxdb.observation.model.TrackedField;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ObservationRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT id, station_id, date_time,
             air_temp, dew_point_temperature, relative_humidity,
             wind_speed, wind_direction, wind_gust, solar_radiation,
             snow_smoothed, precip_accum, precip_intensity,
             snow_depth, snow_interval, snow_water_equiv,
             vapor_pressure, cloud_factor
      FROM tbl_level2
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public ObservationRecord insert(ObservationRecord record) {
    final String sql =
        """
        INSERT INTO tbl_level2 (
          station_id, date_time,
          air_temp, dew_point_temperature, relative_humidity,
          wind_speed, wind_direction, wind_gust, solar_radiation,
          snow_smoothed, precip_accum, precip_intensity,
          snow_depth, snow_interval, snow_water_equiv,
          vapor_pressure, cloud_factor
        ) VALUES (
          :station_id, :date_time,
          :air_temp, :dew_point_temperature, :relative_humidity,
          :wind_speed, :wind_direction, :wind_gust, :solar_radiation,
          :snow_smoothed, :precip_accum, :precip_intensity,
          :snow_depth, :snow_interval, :snow_water_equiv,
          :vapor_pressure, :cloud_factor
        )
        RETURNING id, station_id, date_time,
                  air_temp, dew_point_temperature, relative_humidity,
                  wind_speed, wind_direction, wind_gust, solar_radiation,
                  snow_smoothed, precip_accum, precip_intensity,
                  snow_depth, snow_interval, snow_water_equiv,
                  vapor_pressure, cloud_factor
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("station_id", record.stationId())
            .addValue("date_time", toTimestamp(record.observedAt()));
    // 計測カラムのパラメータ名はカラム名と揃えてある
    for (TrackedField field : TrackedField.values()) {
      params.addValue(field.columnName(), field.valueOf(record));
    }
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<ObservationRecord> findById(long id) {
    final String sql = SELECT_COLUMNS + "WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ObservationRecord> findByIdForUpdate(long id) {
    // 監査を書き終えるまで他トランザクションからの削除/更新を待たせる
    final String sql = SELECT_COLUMNS + "WHERE id = :id FOR UPDATE";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ObservationRecord> findByStationForUpdate(String stationId, Instant from, Instant to) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE station_id = :stationId
              AND date_time >= :from
              AND date_time < :to
            ORDER BY date_time, id
            FOR UPDATE
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("stationId", stationId)
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteById(long id) {
    final String sql = "DELETE FROM tbl_level2 WHERE id = :id";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id));
  }

  private ObservationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return ObservationRecord.builder()
        .id(rs.getLong("id"))
        .stationId(rs.getString("station_id"))
        .observedAt(toInstant(rs.getTimestamp("date_time")))
        .airTemp(rs.getBigDecimal("air_temp"))
        .dewPointTemperature(rs.getBigDecimal("dew_point_temperature"))
        .relativeHumidity(rs.getBigDecimal("relative_humidity"))
        .windSpeed(rs.getBigDecimal("wind_speed"))
        .windDirection(rs.getBigDecimal("wind_direction"))
        .windGust(rs.getBigDecimal("wind_gust"))
        .solarRadiation(rs.getBigDecimal("solar_radiation"))
        .snowSmoothed(rs.getBigDecimal("snow_smoothed"))
        .precipAccum(rs.getBigDecimal("precip_accum"))
        .precipIntensity(rs.getBigDecimal("precip_intensity"))
        .snowDepth(rs.getBigDecimal("snow_depth"))
        .snowInterval(rs.getBigDecimal("snow_interval"))
        .snowWaterEquiv(rs.getBigDecimal("snow_water_equiv"))
        .vaporPressure(rs.getBigDecimal("vapor_pressure"))
        .cloudFactor(rs.getBigDecimal("cloud_factor"))
        .build();
  }
}
