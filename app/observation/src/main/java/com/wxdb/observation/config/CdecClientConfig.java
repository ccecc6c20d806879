/*
 * どこで: Observation 設定
 * 何を: CDEC 呼び出し専用 RestClient を提供する
 * なぜ: 上流ごとに baseUrl 設定責務を分離するため
 */
package com.wxdb.observation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class CdecClientConfig {

  @Bean
  RestClient cdecRestClient(RestClient.Builder builder, CdecProperties properties) {
    return builder.baseUrl(properties.baseUrl()).build();
  }
}
