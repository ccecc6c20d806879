/*
 * どこで: Observation API
 * 何を: 観測値登録リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.wxdb.observation.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ObservationRequest(
    @NotBlank(message = "station_id is required")
        @Size(max = 32, message = "station_id must be at most 32 characters")
        String stationId,
    @NotNull(message = "date_time is required") Instant dateTime,
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
