/*
 * どこで: Observation サービス層
 * 何を: CDEC の観測点情報を tbl_metadata へ取り込む
 * なぜ: 観測値と突き合わせる観測点メタデータを上流から最新化するため
 */
package com.wxdb.observation.service;

import com.wxdb.observation.api.MetadataImportResponse;
import com.wxdb.observation.config.CdecProperties;
import com.wxdb.observation.model.StationMetadataRecord;
import com.wxdb.observation.repository.StationMetadataRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StationMetadataService {

  private static final Logger logger = LoggerFactory.getLogger(StationMetadataService.class);

  static final String SOURCE_CDEC = "cdec";

  private final CdecClient cdecClient;
  private final StationMetadataRepository metadataRepository;
  private final CdecProperties cdecProperties;
  private final ObservationMetrics metrics;
  private final Clock clock;

  public MetadataImportResponse importCdec() {
    logger.info("obtaining station metadata from cdec");
    final List<String> stationIds = cdecClient.fetchAllStationIds();
    int imported = 0;
    int skipped = 0;
    // CDEC は同時リクエストに弱いため、1 観測点ずつ順番に取得する
    for (String stationId : stationIds) {
      final CdecStationInfo info;
      try {
        info = cdecClient.fetchStationInfo(stationId);
      } catch (CdecIntegrationException ex) {
        logger.debug("metadata skipped for {} reason={} message={}", stationId, ex.reason(), ex.getMessage());
        skipped++;
        continue;
      }
      metadataRepository.upsert(toRecord(stationId, info));
      logger.debug("got metadata for {}", stationId);
      imported++;
    }
    metrics.recordMetadataImport("imported", imported);
    metrics.recordMetadataImport("skipped", skipped);
    logger.info(
        "cdec metadata import finished requested={} imported={} skipped={}",
        stationIds.size(),
        imported,
        skipped);
    return new MetadataImportResponse(SOURCE_CDEC, stationIds.size(), imported, skipped);
  }

  private StationMetadataRecord toRecord(String requestedId, CdecStationInfo info) {
    final String primaryId = info.stationId() == null ? requestedId : info.stationId();
    // reported_* は後で位置補正されうる緯度経度の初期値として保持する
    return new StationMetadataRecord(
        primaryId,
        info.stationName(),
        info.latitude(),
        info.longitude(),
        info.elevation(),
        info.agencyName(),
        info.latitude(),
        info.longitude(),
        SOURCE_CDEC,
        cdecProperties.state(),
        cdecProperties.timezone(),
        Instant.now(clock));
  }
}
