/*
 * どこで: Observation API
 * 何を: 観測値 1 行のレスポンスを表す
 * なぜ: カラム名と同じ snake_case の JSON を返すため
 */
package com.wxdb.observation.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ObservationResponse(
    long id,
    String stationId,
    Instant dateTime,
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
