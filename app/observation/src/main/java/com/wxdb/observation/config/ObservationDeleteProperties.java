/*
 * どこで: Observation アプリの設定バインド
 * 何を: 期間指定削除で許容する最大期間を保持する
 * なぜ: 1 トランザクションでロックする行数の上限を運用で調整できるようにするため
 */
package com.wxdb.observation.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "observation.delete")
public record ObservationDeleteProperties(Duration maxRange) {

  public ObservationDeleteProperties {
    maxRange = maxRange == null ? Duration.ofDays(31) : maxRange;
  }
}
