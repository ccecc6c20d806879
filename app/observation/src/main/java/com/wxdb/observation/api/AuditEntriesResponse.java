/*
 * どこで: Observation API
 * 何を: 行 ID ごとの監査一覧のレスポンスを表す
 * なぜ: row_id と entries を明示的に返すため
 */
package com.wxdb.observation.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditEntriesResponse(long rowId, List<AuditEntryResponse> entries) {
  public AuditEntriesResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    if (entries != null) {
      entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }
  }

  @Override
  public List<AuditEntryResponse> entries() {
    if (entries == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(entries));
  }
}
