package com.wxdb.observation.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class TrackedFieldTest {

  @Test
  void enumeratesFifteenColumnsInAuditOrder() {
    assertThat(Arrays.stream(TrackedField.values()).map(TrackedField::columnName))
        .containsExactly(
            "air_temp",
            "dew_point_temperature",
            "relative_humidity",
            "wind_speed",
            "wind_direction",
            "wind_gust",
            "solar_radiation",
            "snow_smoothed",
            "precip_accum",
            "precip_intensity",
            "snow_depth",
            "snow_interval",
            "snow_water_equiv",
            "vapor_pressure",
            "cloud_factor");
  }

  @Test
  void valueOfReadsTheMatchingComponent() {
    final ObservationRecord record =
        ObservationRecord.builder()
            .id(1L)
            .windGust(new BigDecimal("12.5"))
            .snowWaterEquiv(new BigDecimal("0.31"))
            .build();

    assertThat(TrackedField.WIND_GUST.valueOf(record)).isEqualByComparingTo("12.5");
    assertThat(TrackedField.SNOW_WATER_EQUIV.valueOf(record)).isEqualByComparingTo("0.31");
    assertThat(TrackedField.WIND_SPEED.valueOf(record)).isNull();
  }
}
