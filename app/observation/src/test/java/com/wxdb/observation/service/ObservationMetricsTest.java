/*
 * どこで: Observation メトリクステスト
 * 何を: 削除/監査/取り込みのメトリクスが記録されることを検証する
 * なぜ: 運用指標の計測回帰を防ぐため
 */
package com.wxdb.observation.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class ObservationMetricsTest {

  @Test
  void recordsDeleteAuditAndImportMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ObservationMetrics metrics = new ObservationMetrics(registry);

    metrics.recordDelete("single", "success");
    metrics.recordDelete("single", "success");
    metrics.recordDelete("station", "audit_failed");
    metrics.recordAuditEntries(15);
    metrics.recordAuditEntries(0);
    metrics.recordMetadataImport("imported", 3);
    metrics.recordMetadataImport("skipped", 0);

    final Counter singleSuccess =
        registry
            .get("observation.delete.total")
            .tag("mode", "single")
            .tag("result", "success")
            .counter();
    final Counter stationFailed =
        registry
            .get("observation.delete.total")
            .tag("mode", "station")
            .tag("result", "audit_failed")
            .counter();
    final Counter auditEntries = registry.get("observation.audit.entries.total").counter();
    final Counter imported =
        registry.get("observation.metadata.import.total").tag("result", "imported").counter();

    assertThat(singleSuccess.count()).isEqualTo(2.0d);
    assertThat(stationFailed.count()).isEqualTo(1.0d);
    assertThat(auditEntries.count()).isEqualTo(15.0d);
    assertThat(imported.count()).isEqualTo(3.0d);
    assertThat(registry.find("observation.metadata.import.total").tag("result", "skipped").counter())
        .isNull();
  }
}
