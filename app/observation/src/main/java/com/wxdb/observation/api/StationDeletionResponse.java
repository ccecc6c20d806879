/*
 * どこで: Observation API
 * 何を: 観測点・期間指定の一括削除結果を表す
 * なぜ: 削除行数と監査件数をまとめて返すため
 */
package com.wxdb.observation.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StationDeletionResponse(
    String stationId,
    Instant from,
    Instant to,
    int deletedRows,
    int auditEntries,
    String deletedBy,
    Instant deletedAt) {}
