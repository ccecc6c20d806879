/*
 * どこで: Observation API
 * 何を: 単一行削除の結果を表す
 * なぜ: 削除された行と書き込まれた監査件数を呼び出し側へ返すため
 */
package com.wxdb.observation.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ObservationDeletionResponse(
    long rowId, int auditEntries, String deletedBy, Instant deletedAt) {}
