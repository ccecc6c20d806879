package com.wxdb.observation.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditEntryResponse(
    long auditId,
    String action,
    String userName,
    Instant occurredAt,
    long rowId,
    String fieldName,
    BigDecimal fieldValue) {}
