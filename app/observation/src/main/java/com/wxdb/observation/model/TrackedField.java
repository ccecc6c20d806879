/*
 * どこで: Observation ドメインモデル
 * 何を: 削除監査の対象となる計測カラムと、その値の取り出し方を列挙する
 * なぜ: カラム追加を列挙子 1 行の追加で済ませ、監査の出力順を固定するため
 */
package com.wxdb.observation.model;

import java.math.BigDecimal;
import java.util.function.Function;

public enum TrackedField {
  AIR_TEMP("air_temp", ObservationRecord::airTemp),
  DEW_POINT_TEMPERATURE("dew_point_temperature", ObservationRecord::dewPointTemperature),
  RELATIVE_HUMIDITY("relative_humidity", ObservationRecord::relativeHumidity),
  WIND_SPEED("wind_speed", ObservationRecord::windSpeed),
  WIND_DIRECTION("wind_direction", ObservationRecord::windDirection),
  WIND_GUST("wind_gust", ObservationRecord::windGust),
  SOLAR_RADIATION("solar_radiation", ObservationRecord::solarRadiation),
  SNOW_SMOOTHED("snow_smoothed", ObservationRecord::snowSmoothed),
  PRECIP_ACCUM("precip_accum", ObservationRecord::precipAccum),
  PRECIP_INTENSITY("precip_intensity", ObservationRecord::precipIntensity),
  SNOW_DEPTH("snow_depth", ObservationRecord::snowDepth),
  SNOW_INTERVAL("snow_interval", ObservationRecord::snowInterval),
  SNOW_WATER_EQUIV("snow_water_equiv", ObservationRecord::snowWaterEquiv),
  VAPOR_PRESSURE("vapor_pressure", ObservationRecord::vaporPressure),
  CLOUD_FACTOR("cloud_factor", ObservationRecord::cloudFactor);

  private final String columnName;
  private final Function<ObservationRecord, BigDecimal> accessor;

  TrackedField(String columnName, Function<ObservationRecord, BigDecimal> accessor) {
    this.columnName = columnName;
    this.accessor = accessor;
  }

  public String columnName() {
    return columnName;
  }

  public BigDecimal valueOf(ObservationRecord record) {
    return accessor.apply(record);
  }
}
