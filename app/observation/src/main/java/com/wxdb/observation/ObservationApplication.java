/*
 * どこで: Observation アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスと共通の Clock をまとめて有効化するため
 */
package com.wxdb.observation;

import com.wxdb.common.config.ClockConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(ClockConfig.class)
public class ObservationApplication {

  public static void main(String[] args) {
    SpringApplication.run(ObservationApplication.class, args);
  }
}
