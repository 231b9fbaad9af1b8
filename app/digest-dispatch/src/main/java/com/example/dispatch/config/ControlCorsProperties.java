/*
 * どこで: Digest Dispatch の設定バインド
 * 何を: ブラウザから制御 API を呼ぶときの CORS 応答ヘッダの内容を保持する
 * なぜ: 運用ダッシュボードのオリジンを環境ごとに切り替えるため
 */
package com.example.dispatch.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "digest.control.cors")
public record ControlCorsProperties(
    List<String> allowedOrigins,
    List<String> allowedMethods,
    List<String> allowedHeaders,
    Duration maxAge) {

  public ControlCorsProperties {
    allowedOrigins =
        allowedOrigins == null
            ? List.of("http://localhost:3000", "http://localhost:5000")
            : allowedOrigins.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
    allowedMethods = allowedMethods == null ? List.of("GET", "POST", "OPTIONS") : allowedMethods;
    allowedHeaders =
        allowedHeaders == null
            ? List.of("Content-Type", "Authorization", "X-Timestamp", "X-Signature")
            : allowedHeaders;
    maxAge = maxAge == null ? Duration.ofSeconds(86400) : maxAge;
  }
}
