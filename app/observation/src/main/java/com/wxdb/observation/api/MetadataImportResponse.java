/*
 * どこで: Observation API
 * 何を: 観測点メタデータ取り込みの結果を表す
 * なぜ: 取り込めなかった観測点の件数を運用者が確認できるようにするため
 */
package com.wxdb.observation.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MetadataImportResponse(String source, int requested, int imported, int skipped) {}
