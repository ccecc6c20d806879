/*
 * どこで: Observation ドメインモデル
 * 何を: tbl_level2 の 1 行(識別子・観測点・観測時刻・15 の計測値)を表す
 * なぜ: 削除前の行イメージを監査レコード生成へそのまま渡すため
 */
package com.wxdb.observation.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record ObservationRecord(
    Long id,
    String stationId,
    Instant observedAt,
    BigDecimal airTemp,
    BigDecimal dewPointTemperature,
    BigDecimal relativeHumidity,
    BigDecimal windSpeed,
    BigDecimal windDirection,
    BigDecimal windGust,
    BigDecimal solarRadiation,
    BigDecimal snowSmoothed,
    BigDecimal precipAccum,
    BigDecimal precipIntensity,
    BigDecimal snowDepth,
    BigDecimal snowInterval,
    BigDecimal snowWaterEquiv,
    BigDecimal vaporPressure,
    BigDecimal cloudFactor) {}
