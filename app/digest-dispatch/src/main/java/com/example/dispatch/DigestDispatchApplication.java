/*
 * どこで: Digest Dispatch アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスと定期配信スケジュールをまとめて有効化するため
 */
package com.example.dispatch;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class DigestDispatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(DigestDispatchApplication.class, args);
  }
}
