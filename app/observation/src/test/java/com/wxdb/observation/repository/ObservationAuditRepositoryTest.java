/*
 * どこで: ObservationAuditRepository の統合テスト
 * 何を: 監査の追記と row_id 単位の参照順を検証する
 * なぜ: 監査一覧が書き込み順で返ることを保証するため
 */
package com.wxdb.observation.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.wxdb.observation.AbstractPostgresContainerTest;
import com.wxdb.observation.model.ObservationAuditRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ObservationAuditRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant OCCURRED_AT = Instant.parse("2026-02-01T09:15:00Z");

  @Autowired private ObservationAuditRepository auditRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM tbl_level2_audit", new MapSqlParameterSource());
  }

  @Test
  void insertAppendsAndFindByRowIdReturnsInWriteOrder() {
    assertThat(auditRepository.insert(entry(5L, "snow_depth", "120.4"))).isEqualTo(1);
    assertThat(auditRepository.insert(entry(5L, "air_temp", "-3.5"))).isEqualTo(1);
    assertThat(auditRepository.insert(entry(6L, "air_temp", "1.0"))).isEqualTo(1);

    final List<ObservationAuditRecord> entries = auditRepository.findByRowId(5L);

    assertThat(entries).extracting(ObservationAuditRecord::fieldName)
        .containsExactly("snow_depth", "air_temp");
    assertThat(entries.get(0).auditId()).isLessThan(entries.get(1).auditId());
    assertThat(entries.get(0).fieldValue()).isEqualByComparingTo("120.4");
    assertThat(entries.get(1).fieldValue()).isEqualByComparingTo("-3.5");
    assertThat(entries.get(1).occurredAt()).isEqualTo(OCCURRED_AT);
    assertThat(entries.get(1).userName()).isEqualTo("svc_ingest");
  }

  @Test
  void findByRowIdReturnsEmptyForUnknownRow() {
    assertThat(auditRepository.findByRowId(404L)).isEmpty();
  }

  private ObservationAuditRecord entry(long rowId, String fieldName, String value) {
    return new ObservationAuditRecord(
        null, "delete", "svc_ingest", OCCURRED_AT, rowId, fieldName, new BigDecimal(value));
  }
}
