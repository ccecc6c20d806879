package com.wxdb.observation;

import com.wxdb.observation.model.ObservationRecord;
import java.math.BigDecimal;
import java.time.Instant;

public final class ObservationFixtures {

  public static final String STATION_ID = "CDEC-TUM";
  public static final Instant OBSERVED_AT = Instant.parse("2026-01-17T00:00:00Z");

  private ObservationFixtures() {}

  /** air_temp と relative_humidity だけが非 NULL の行。 */
  public static ObservationRecord.ObservationRecordBuilder sparseRow() {
    return ObservationRecord.builder()
        .stationId(STATION_ID)
        .observedAt(OBSERVED_AT)
        .airTemp(new BigDecimal("15.2"))
        .relativeHumidity(new BigDecimal("88"));
  }

  public static ObservationRecord.ObservationRecordBuilder emptyRow() {
    return ObservationRecord.builder().stationId(STATION_ID).observedAt(OBSERVED_AT);
  }

  /** 15 カラムすべてが非 NULL の行。値は 1..15 をカラム順に割り当てる。 */
  public static ObservationRecord.ObservationRecordBuilder fullRow() {
    return ObservationRecord.builder()
        .stationId(STATION_ID)
        .observedAt(OBSERVED_AT)
        .airTemp(new BigDecimal("1"))
        .dewPointTemperature(new BigDecimal("2"))
        .relativeHumidity(new BigDecimal("3"))
        .windSpeed(new BigDecimal("4"))
        .windDirection(new BigDecimal("5"))
        .windGust(new BigDecimal("6"))
        .solarRadiation(new BigDecimal("7"))
        .snowSmoothed(new BigDecimal("8"))
        .precipAccum(new BigDecimal("9"))
        .precipIntensity(new BigDecimal("10"))
        .snowDepth(new BigDecimal("11"))
        .snowInterval(new BigDecimal("12"))
        .snowWaterEquiv(new BigDecimal("13"))
        .vaporPressure(new BigDecimal("14"))
        .cloudFactor(new BigDecimal("15"));
  }
}
