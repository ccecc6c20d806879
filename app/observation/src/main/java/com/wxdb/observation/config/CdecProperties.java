/*
 * どこで: Observation アプリの設定バインド
 * 何を: CDEC 呼び出し先と取り込み時の固定属性を保持する
 * なぜ: 上流 URL とパス、観測点に付与する州/タイムゾーンを外部化するため
 */
package com.wxdb.observation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "observation.cdec")
public record CdecProperties(
    String baseUrl,
    String allStationsPath,
    String stationInfoPath,
    String state,
    String timezone) {

  public CdecProperties {
    baseUrl = isBlank(baseUrl) ? "http://cdec.water.ca.gov" : baseUrl;
    allStationsPath =
        isBlank(allStationsPath) ? "/cdecstation2/CDecServlet/getAllStations" : allStationsPath;
    stationInfoPath =
        isBlank(stationInfoPath) ? "/cdecstation2/CDecServlet/getStationInfo" : stationInfoPath;
    state = isBlank(state) ? "CA" : state;
    // TODO: 夏時間以外の期間も PDT でよいか観測点の管理者に確認する
    timezone = isBlank(timezone) ? "PDT" : timezone;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
