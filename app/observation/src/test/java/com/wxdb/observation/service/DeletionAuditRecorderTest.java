/*
 * どこで: DeletionAuditRecorder のユニットテスト
 * 何を: 非 NULL カラムごとの監査生成・出力順・書き込み失敗時の中断を検証する
 * なぜ: 削除監査の件数と内容が行イメージと一致することを保証するため
 */
package com.wxdb.observation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.wxdb.observation.ObservationFixtures;
import com.wxdb.observation.model.ObservationAuditRecord;
import com.wxdb.observation.model.ObservationRecord;
import com.wxdb.observation.model.TrackedField;
import com.wxdb.observation.repository.ObservationAuditRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class DeletionAuditRecorderTest {

  private static final Instant DELETED_AT = Instant.parse("2026-02-01T09:15:00Z");
  private static final String PRINCIPAL = "svc_ingest";

  @Mock private ObservationAuditRepository auditRepository;

  @Captor private ArgumentCaptor<ObservationAuditRecord> recordCaptor;

  private DeletionAuditRecorder recorder;

  @BeforeEach
  void setUp() {
    recorder = new DeletionAuditRecorder(auditRepository);
  }

  @Test
  void recordWritesOneEntryPerNonNullField() {
    final ObservationRecord row = ObservationFixtures.sparseRow().id(42L).build();
    when(auditRepository.insert(any())).thenReturn(1);

    final List<ObservationAuditRecord> entries = recorder.record(row, PRINCIPAL, DELETED_AT);

    verify(auditRepository, times(2)).insert(recordCaptor.capture());
    assertThat(recordCaptor.getAllValues()).isEqualTo(entries);
    assertThat(entries)
        .extracting(ObservationAuditRecord::fieldName)
        .containsExactly("air_temp", "relative_humidity");

    final ObservationAuditRecord airTemp = entries.get(0);
    assertThat(airTemp.auditId()).isNull();
    assertThat(airTemp.action()).isEqualTo("delete");
    assertThat(airTemp.userName()).isEqualTo(PRINCIPAL);
    assertThat(airTemp.occurredAt()).isEqualTo(DELETED_AT);
    assertThat(airTemp.rowId()).isEqualTo(42L);
    assertThat(airTemp.fieldValue()).isEqualByComparingTo("15.2");
    assertThat(entries.get(1).fieldValue()).isEqualByComparingTo("88");
  }

  @Test
  void entriesForReturnsNothingWhenAllFieldsAreNull() {
    final ObservationRecord row = ObservationFixtures.emptyRow().id(7L).build();

    assertThat(recorder.entriesFor(row, PRINCIPAL, DELETED_AT)).isEmpty();
  }

  @Test
  void recordDoesNotTouchStoreWhenAllFieldsAreNull() {
    final ObservationRecord row = ObservationFixtures.emptyRow().id(7L).build();

    assertThat(recorder.record(row, PRINCIPAL, DELETED_AT)).isEmpty();

    verify(auditRepository, never()).insert(any());
  }

  @Test
  void entriesForCoversAllFifteenFieldsInEnumerationOrder() {
    final ObservationRecord row = ObservationFixtures.fullRow().id(9L).build();

    final List<ObservationAuditRecord> entries = recorder.entriesFor(row, PRINCIPAL, DELETED_AT);

    assertThat(entries).hasSize(15);
    assertThat(entries)
        .extracting(ObservationAuditRecord::fieldName)
        .containsExactlyElementsOf(
            Arrays.stream(TrackedField.values()).map(TrackedField::columnName).toList());
    // fullRow はカラム順に 1..15 を持つ
    for (int i = 0; i < entries.size(); i++) {
      assertThat(entries.get(i).fieldValue()).isEqualByComparingTo(BigDecimal.valueOf(i + 1L));
      assertThat(entries.get(i).rowId()).isEqualTo(9L);
    }
  }

  @Test
  void recordStopsAtFirstFailedWrite() {
    final ObservationRecord row = ObservationFixtures.fullRow().id(9L).build();
    when(auditRepository.insert(any()))
        .thenReturn(1)
        .thenThrow(new DataAccessResourceFailureException("audit store unavailable"));

    assertThatThrownBy(() -> recorder.record(row, PRINCIPAL, DELETED_AT))
        .isInstanceOf(AuditWriteException.class)
        .hasMessageContaining("field=dew_point_temperature")
        .hasCauseInstanceOf(DataAccessResourceFailureException.class);

    verify(auditRepository, times(2)).insert(any());
  }

  @Test
  void recordFailsWhenInsertStoresNothing() {
    final ObservationRecord row = ObservationFixtures.sparseRow().id(42L).build();
    when(auditRepository.insert(any())).thenReturn(0);

    assertThatThrownBy(() -> recorder.record(row, PRINCIPAL, DELETED_AT))
        .isInstanceOf(AuditWriteException.class)
        .hasMessage("audit entry not stored row_id=42 field=air_temp");
  }

  @Test
  void entriesForRejectsMissingInputs() {
    final ObservationRecord unsaved = ObservationFixtures.sparseRow().build();
    final ObservationRecord row = ObservationFixtures.sparseRow().id(42L).build();

    assertThatThrownBy(() -> recorder.entriesFor(unsaved, PRINCIPAL, DELETED_AT))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("row id is required");
    assertThatThrownBy(() -> recorder.entriesFor(row, " ", DELETED_AT))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("principal is required");
    assertThatThrownBy(() -> recorder.entriesFor(row, PRINCIPAL, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("occurredAt is required");
  }
}
