/*
 * どこで: Observation サービス層
 * 何を: 削除される行の非 NULL 計測値ごとに監査レコードを 1 件ずつ生成・追記する
 * なぜ: 削除と同じトランザクションで削除前の値を残すため
 */
package com.wxdb.observation.service;

import com.wxdb.observation.model.ObservationAuditRecord;
import com.wxdb.observation.model.ObservationRecord;
import com.wxdb.observation.model.TrackedField;
import com.wxdb.observation.repository.ObservationAuditRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeletionAuditRecorder {

  public static final String ACTION_DELETE = "delete";

  private final ObservationAuditRepository auditRepository;

  /**
   * Builds the audit entries for a row about to be deleted, one per non-null tracked field, in
   * {@link TrackedField} declaration order. Nothing is written.
   */
  public List<ObservationAuditRecord> entriesFor(
      ObservationRecord row, String principal, Instant occurredAt) {
    if (row == null || row.id() == null) {
      throw new IllegalArgumentException("row id is required");
    }
    if (principal == null || principal.isBlank()) {
      throw new IllegalArgumentException("principal is required");
    }
    if (occurredAt == null) {
      throw new IllegalArgumentException("occurredAt is required");
    }
    final List<ObservationAuditRecord> entries = new ArrayList<>();
    for (TrackedField field : TrackedField.values()) {
      final BigDecimal value = field.valueOf(row);
      if (value == null) {
        continue;
      }
      entries.add(
          new ObservationAuditRecord(
              null, ACTION_DELETE, principal, occurredAt, row.id(), field.columnName(), value));
    }
    return entries;
  }

  /**
   * Appends the audit entries for {@code row} to the audit store. Must run inside the deleting
   * transaction; the first failed write aborts the remaining fields.
   *
   * @throws AuditWriteException when any entry cannot be written
   */
  public List<ObservationAuditRecord> record(
      ObservationRecord row, String principal, Instant occurredAt) {
    final List<ObservationAuditRecord> entries = entriesFor(row, principal, occurredAt);
    for (ObservationAuditRecord entry : entries) {
      write(entry);
    }
    return entries;
  }

  private void write(ObservationAuditRecord entry) {
    final int inserted;
    try {
      inserted = auditRepository.insert(entry);
    } catch (DataAccessException ex) {
      throw new AuditWriteException(
          "failed to write audit entry row_id=" + entry.rowId() + " field=" + entry.fieldName(),
          ex);
    }
    if (inserted != 1) {
      throw new AuditWriteException(
          "audit entry not stored row_id=" + entry.rowId() + " field=" + entry.fieldName());
    }
  }
}
