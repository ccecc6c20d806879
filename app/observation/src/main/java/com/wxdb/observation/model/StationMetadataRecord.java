/*
 * どこで: Observation ドメインモデル
 * 何を: tbl_metadata の観測点メタデータを表す
 * なぜ: 外部ソース(CDEC)から取り込んだ観測点情報を共通の形で保存するため
 */
package com.wxdb.observation.model;

import java.math.BigDecimal;
import java.time.Instant;

public record StationMetadataRecord(
    String primaryId,
    String stationName,
    BigDecimal latitude,
    BigDecimal longitude,
    BigDecimal elevation,
    String primaryProvider,
    BigDecimal reportedLat,
    BigDecimal reportedLong,
    String source,
    String state,
    String timezone,
    Instant updatedAt) {}
