/*
 * どこで: Observation サービス層
 * 何を: CDEC(California Data Exchange Center)の観測点一覧/観測点情報を取得する
 * なぜ: tbl_metadata を上流の観測点情報で埋めるため
 */
package com.wxdb.observation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wxdb.observation.config.CdecProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class CdecClient {

  private static final Logger logger = LoggerFactory.getLogger(CdecClient.class);

  private static final String FIELD_STATION = "STATION";
  private static final String FIELD_STATION_ID = "STATION_ID";

  private final RestClient cdecRestClient;
  private final CdecProperties properties;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public CdecClient(RestClient cdecRestClient, CdecProperties properties, ObjectMapper objectMapper) {
    this.cdecRestClient = cdecRestClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  public List<String> fetchAllStationIds() {
    final JsonNode stations = fetchStations(properties.allStationsPath(), null);
    final List<String> stationIds = new ArrayList<>();
    for (JsonNode station : stations) {
      final String stationId = text(station, FIELD_STATION_ID);
      if (stationId != null) {
        stationIds.add(stationId);
      }
    }
    return stationIds;
  }

  public CdecStationInfo fetchStationInfo(String stationId) {
    if (stationId == null || stationId.isBlank()) {
      throw new IllegalArgumentException("stationId is required");
    }
    final JsonNode stations = fetchStations(properties.stationInfoPath(), stationId);
    if (stations.isEmpty()) {
      throw new CdecIntegrationException(
          CdecIntegrationException.Reason.INVALID_RESPONSE,
          "cdec station info is empty for " + stationId);
    }
    // 観測点情報はセンサーごとに 1 レコードずつ返るため、先頭のみを使う
    final JsonNode first = stations.get(0);
    try {
      return new CdecStationInfo(
          text(first, FIELD_STATION_ID),
          text(first, "STATION_NAME"),
          decimal(first, "LATITUDE"),
          decimal(first, "LONGITUDE"),
          decimal(first, "ELEVATION"),
          text(first, "AGENCY_NAME"));
    } catch (NumberFormatException ex) {
      throw new CdecIntegrationException(
          CdecIntegrationException.Reason.INVALID_RESPONSE,
          "cdec station info has a non-numeric coordinate for " + stationId,
          ex);
    }
  }

  private JsonNode fetchStations(String path, String stationId) {
    final String body;
    try {
      // CDEC は Content-Type が JSON とは限らないため、文字列で受けてから解釈する
      body =
          cdecRestClient
              .get()
              .uri(
                  uriBuilder -> {
                    uriBuilder.path(path);
                    if (stationId != null) {
                      uriBuilder.queryParam("stationID", stationId);
                    }
                    return uriBuilder.build();
                  })
              .retrieve()
              .body(String.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, path);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, path);
    }
    return parseStations(body, path);
  }

  private JsonNode parseStations(String body, String path) {
    if (body == null || body.isBlank()) {
      throw new CdecIntegrationException(
          CdecIntegrationException.Reason.INVALID_RESPONSE, "cdec response is empty: " + path);
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new CdecIntegrationException(
          CdecIntegrationException.Reason.INVALID_RESPONSE, "cdec response parse failed: " + path, ex);
    }
    final JsonNode stations = root.get(FIELD_STATION);
    if (stations == null || !stations.isArray()) {
      throw new CdecIntegrationException(
          CdecIntegrationException.Reason.INVALID_RESPONSE, "cdec response has no STATION array: " + path);
    }
    return stations;
  }

  private CdecIntegrationException mapResponseException(RestClientResponseException ex, String path) {
    logger.warn(
        "cdec request failed path={} status={} statusText={}",
        path,
        ex.getStatusCode().value(),
        ex.getStatusText());
    return new CdecIntegrationException(
        CdecIntegrationException.Reason.BAD_GATEWAY, "cdec request failed: " + path, ex);
  }

  private CdecIntegrationException mapResourceException(ResourceAccessException ex, String path) {
    if (isTimeout(ex)) {
      logger.warn("cdec request timed out path={}", path);
      return new CdecIntegrationException(
          CdecIntegrationException.Reason.TIMEOUT, "cdec request timeout: " + path, ex);
    }
    logger.warn("cdec connection failed path={}", path, ex);
    return new CdecIntegrationException(
        CdecIntegrationException.Reason.BAD_GATEWAY, "cdec connection failed: " + path, ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static String text(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    final String text = value.asText().trim();
    return text.isEmpty() ? null : text;
  }

  private static BigDecimal decimal(JsonNode node, String field) {
    final String text = text(node, field);
    return text == null ? null : new BigDecimal(text);
  }
}
