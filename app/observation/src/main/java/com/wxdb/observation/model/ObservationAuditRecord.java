/*
 * どこで: Observation ドメインモデル
 * 何を: tbl_level2_audit の 1 行を表す
 * なぜ: 削除前の値を追記専用の監査ストアへ残すため
 */
package com.wxdb.observation.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only audit row. {@code auditId} is {@code null} until the store assigns it.
 */
public record ObservationAuditRecord(
    Long auditId,
    String action,
    String userName,
    Instant occurredAt,
    long rowId,
    String fieldName,
    BigDecimal fieldValue) {}
