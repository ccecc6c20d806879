/*
 * どこで: Observation サービス層
 * 何を: 削除/監査/メタデータ取り込みのアプリ固有メトリクス記録を集約する
 * なぜ: 削除失敗や監査件数の推移を運用で継続監視できるようにするため
 */
package com.wxdb.observation.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ObservationMetrics {

  private static final String METRIC_DELETE_TOTAL = "observation.delete.total";
  private static final String METRIC_AUDIT_ENTRIES_TOTAL = "observation.audit.entries.total";
  private static final String METRIC_METADATA_IMPORT_TOTAL = "observation.metadata.import.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> deleteCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> importCounters = new ConcurrentHashMap<>();
  private final Counter auditEntriesCounter;

  public ObservationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.auditEntriesCounter =
        Counter.builder(METRIC_AUDIT_ENTRIES_TOTAL)
            .description("Audit entries written for deleted observations")
            .register(meterRegistry);
  }

  public void recordDelete(String mode, String result) {
    final String key = mode + ":" + result;
    deleteCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_DELETE_TOTAL)
                    .description("Observation delete executions")
                    .tags(Tags.of("mode", mode, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordAuditEntries(int count) {
    if (count <= 0) {
      return;
    }
    auditEntriesCounter.increment(count);
  }

  public void recordMetadataImport(String result, int count) {
    if (count <= 0) {
      return;
    }
    importCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_METADATA_IMPORT_TOTAL)
                    .description("Station metadata import results")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment(count);
  }
}
