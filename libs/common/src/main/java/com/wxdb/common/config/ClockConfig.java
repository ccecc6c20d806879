/*
 * どこで: Common 共通設定
 * 何を: UTC 固定の Clock を Bean として提供する
 * なぜ: 削除時刻と監査時刻をテストで固定できるようにするため
 */
package com.wxdb.common.config;

import java.time.Clock;
import java.time.ZoneOffset;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class ClockConfig {

  // 監査の occurred_at は UTC で保存する
  @Bean
  public Clock utcClock() {
    return Clock.system(ZoneOffset.UTC);
  }
}
