/*
 * どこで: Observation API
 * 何を: 観測値の登録/参照/監査付き削除/監査参照のエンドポイントを提供する
 * なぜ: アプリの公開インターフェースを明確にするため
 */
package com.wxdb.observation.api;

import com.wxdb.observation.service.ObservationService;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import lombok.RequiredArgsConstructor;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class ObservationController {

    private static final String HEADER_USER_ID = "X-User-Id";

    private final ObservationService observationService;

    @PostMapping("/observations")
    public ResponseEntity<ObservationResponse> create(@Valid @RequestBody ObservationRequest request) {
        ObservationResponse response = observationService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/observations/{id}")
    public ObservationResponse get(@PathVariable("id") long id) {
        return observationService.get(id);
    }

    @DeleteMapping("/observations/{id}")
    public ObservationDeletionResponse delete(
            @PathVariable("id") long id,
            @RequestHeader(value = HEADER_USER_ID)
            @NotBlank(message = "X-User-Id is required")
            @Size(max = ObservationService.MAX_PRINCIPAL_LENGTH,
                    message = "X-User-Id must be at most {max} characters")
            String principal) {
        return observationService.delete(id, principal);
    }

    @DeleteMapping("/stations/{station_id}/observations")
    public StationDeletionResponse deleteByStation(
            @PathVariable("station_id")
            @NotBlank(message = "station_id is required")
            String stationId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestHeader(value = HEADER_USER_ID)
            @NotBlank(message = "X-User-Id is required")
            @Size(max = ObservationService.MAX_PRINCIPAL_LENGTH,
                    message = "X-User-Id must be at most {max} characters")
            String principal) {
        return observationService.deleteByStation(stationId, from, to, principal);
    }

    @GetMapping("/observations/{id}/audit")
    public AuditEntriesResponse listAudit(@PathVariable("id") long id) {
        return observationService.listAudit(id);
    }
}
