package com.wxdb.observation.service;

import java.math.BigDecimal;

/** First record of a CDEC station-info document. */
public record CdecStationInfo(
    String stationId,
    String stationName,
    BigDecimal latitude,
    BigDecimal longitude,
    BigDecimal elevation,
    String agencyName) {}
