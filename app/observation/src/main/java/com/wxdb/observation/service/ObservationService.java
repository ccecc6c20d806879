/*
 * どこで: Observation サービス層
 * 何を: 観測値の登録/参照と、監査付き削除(単一行・観測点期間指定)を担う
 * なぜ: 監査の書き込みと行削除を同一トランザクションで全件成功か全件失敗にするため
 */
package com.wxdb.observation.service;

import com.wxdb.observation.api.AuditEntriesResponse;
import com.wxdb.observation.api.AuditEntryResponse;
import com.wxdb.observation.api.ObservationDeletionResponse;
import com.wxdb.observation.api.ObservationNotFoundException;
import com.wxdb.observation.api.ObservationRequest;
import com.wxdb.observation.api.ObservationResponse;
import com.wxdb.observation.api.StationDeletionResponse;
import com.wxdb.observation.config.ObservationDeleteProperties;
import com.wxdb.observation.model.ObservationAuditRecord;
import com.wxdb.observation.model.ObservationRecord;
import com.wxdb.observation.repository.ObservationAuditRepository;
import com.wxdb.observation.repository.ObservationRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import lombok.RequiredArgsConstructor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ObservationService {

    private static final Logger logger = LoggerFactory.getLogger(ObservationService.class);

    /** tbl_level2_audit.user_name の桁数。 */
    public static final int MAX_PRINCIPAL_LENGTH = 128;

    private static final String MODE_SINGLE = "single";
    private static final String MODE_STATION = "station";
    private static final String RESULT_SUCCESS = "success";
    private static final String RESULT_NOT_FOUND = "not_found";
    private static final String RESULT_AUDIT_FAILED = "audit_failed";

    private final ObservationRepository observationRepository;
    private final ObservationAuditRepository auditRepository;
    private final DeletionAuditRecorder auditRecorder;
    private final ObservationMetrics metrics;
    private final ObservationDeleteProperties deleteProperties;
    private final Clock clock;

    @Transactional
    public ObservationResponse create(ObservationRequest request) {
        ObservationRecord stored = observationRepository.insert(toRecord(request));
        logger.debug("observation stored id={} station_id={} date_time={}",
                stored.id(), stored.stationId(), stored.observedAt());
        return toResponse(stored);
    }

    @Transactional(readOnly = true)
    public ObservationResponse get(long id) {
        return observationRepository.findById(id)
                .map(this::toResponse)
                .orElseThrow(() -> notFound(id));
    }

    @Transactional(readOnly = true)
    public AuditEntriesResponse listAudit(long rowId) {
        List<AuditEntryResponse> entries = auditRepository.findByRowId(rowId).stream()
                .map(this::toAuditResponse)
                .toList();
        return new AuditEntriesResponse(rowId, entries);
    }

    @Transactional
    public ObservationDeletionResponse delete(long id, String principal) {
        requirePrincipal(principal);
        // 行ロックを取ってから削除前イメージを読み、監査→削除の順に実行する
        ObservationRecord row = observationRepository.findByIdForUpdate(id).orElse(null);
        if (row == null) {
            metrics.recordDelete(MODE_SINGLE, RESULT_NOT_FOUND);
            throw notFound(id);
        }
        Instant now = Instant.now(clock);
        int entries;
        try {
            entries = deleteWithAudit(row, principal, now);
        } catch (AuditWriteException ex) {
            metrics.recordDelete(MODE_SINGLE, RESULT_AUDIT_FAILED);
            throw ex;
        }
        metrics.recordDelete(MODE_SINGLE, RESULT_SUCCESS);
        metrics.recordAuditEntries(entries);
        logger.info("observation deleted id={} principal={} auditEntries={}", id, principal, entries);
        return new ObservationDeletionResponse(id, entries, principal, now);
    }

    @Transactional
    public StationDeletionResponse deleteByStation(
            String stationId, Instant from, Instant to, String principal) {
        requirePrincipal(principal);
        validateRange(stationId, from, to);
        List<ObservationRecord> rows = observationRepository.findByStationForUpdate(stationId, from, to);
        Instant now = Instant.now(clock);
        int entries = 0;
        try {
            // 行ごとに監査を書き、1 件でも失敗すれば全体をロールバックさせる
            for (ObservationRecord row : rows) {
                entries += deleteWithAudit(row, principal, now);
            }
        } catch (AuditWriteException ex) {
            metrics.recordDelete(MODE_STATION, RESULT_AUDIT_FAILED);
            throw ex;
        }
        metrics.recordDelete(MODE_STATION, RESULT_SUCCESS);
        metrics.recordAuditEntries(entries);
        logger.info(
                "station observations deleted station_id={} from={} to={} principal={} rows={} auditEntries={}",
                stationId, from, to, principal, rows.size(), entries);
        return new StationDeletionResponse(stationId, from, to, rows.size(), entries, principal, now);
    }

    private int deleteWithAudit(ObservationRecord row, String principal, Instant now) {
        List<ObservationAuditRecord> written = auditRecorder.record(row, principal, now);
        int deleted = observationRepository.deleteById(row.id());
        if (deleted != 1) {
            // FOR UPDATE で確保した行が消えていることは想定しない
            throw new IllegalStateException("locked observation was not deleted id=" + row.id());
        }
        return written.size();
    }

    private void requirePrincipal(String principal) {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("X-User-Id is required");
        }
        if (principal.length() > MAX_PRINCIPAL_LENGTH) {
            throw new IllegalArgumentException(
                    "X-User-Id must be at most " + MAX_PRINCIPAL_LENGTH + " characters");
        }
    }

    private void validateRange(String stationId, Instant from, Instant to) {
        if (stationId == null || stationId.isBlank()) {
            throw new IllegalArgumentException("station_id is required");
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to are required");
        }
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("from must be before to");
        }
        Duration maxRange = deleteProperties.maxRange();
        if (Duration.between(from, to).compareTo(maxRange) > 0) {
            throw new IllegalArgumentException("range must not exceed " + maxRange);
        }
    }

    private ObservationNotFoundException notFound(long id) {
        return new ObservationNotFoundException("observation not found: " + id);
    }

    private ObservationRecord toRecord(ObservationRequest request) {
        return ObservationRecord.builder()
                .stationId(request.stationId())
                .observedAt(request.dateTime())
                .airTemp(request.airTemp())
                .dewPointTemperature(request.dewPointTemperature())
                .relativeHumidity(request.relativeHumidity())
                .windSpeed(request.windSpeed())
                .windDirection(request.windDirection())
                .windGust(request.windGust())
                .solarRadiation(request.solarRadiation())
                .snowSmoothed(request.snowSmoothed())
                .precipAccum(request.precipAccum())
                .precipIntensity(request.precipIntensity())
                .snowDepth(request.snowDepth())
                .snowInterval(request.snowInterval())
                .snowWaterEquiv(request.snowWaterEquiv())
                .vaporPressure(request.vaporPressure())
                .cloudFactor(request.cloudFactor())
                .build();
    }

    private ObservationResponse toResponse(ObservationRecord record) {
        return new ObservationResponse(
                record.id(),
                record.stationId(),
                record.observedAt(),
                record.airTemp(),
                record.dewPointTemperature(),
                record.relativeHumidity(),
                record.windSpeed(),
                record.windDirection(),
                record.windGust(),
                record.solarRadiation(),
                record.snowSmoothed(),
                record.precipAccum(),
                record.precipIntensity(),
                record.snowDepth(),
                record.snowInterval(),
                record.snowWaterEquiv(),
                record.vaporPressure(),
                record.cloudFactor());
    }

    private AuditEntryResponse toAuditResponse(ObservationAuditRecord record) {
        return new AuditEntryResponse(
                record.auditId(),
                record.action(),
                record.userName(),
                record.occurredAt(),
                record.rowId(),
                record.fieldName(),
                record.fieldValue());
    }
}
