/*
 * どこで: Digest Dispatch アプリの設定バインド
 * 何を: メール送信 API の接続先・認証・差出人設定を保持する
 * なぜ: 送信プロバイダと送信モード(local/http)を環境ごとに切り替えるため
 */
package com.example.dispatch.config;

import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "digest.transport")
@Validated
public record TransportProperties(
    @Pattern(regexp = "local|http", message = "digest.transport.mode must be local or http")
        String mode,
    String baseUrl,
    String sendPath,
    String apiKey,
    String apiKeyHeaderName,
    String fromAddress,
    String replyTo,
    Duration connectTimeout,
    Duration readTimeout) {

  public TransportProperties {
    mode = mode == null || mode.isBlank() ? "local" : mode;
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.smtp2go.com" : baseUrl;
    sendPath = sendPath == null || sendPath.isBlank() ? "/v3/email/send" : sendPath;
    apiKey = apiKey == null ? "" : apiKey;
    apiKeyHeaderName =
        apiKeyHeaderName == null || apiKeyHeaderName.isBlank()
            ? "X-Smtp2go-Api-Key"
            : apiKeyHeaderName;
    fromAddress = fromAddress == null ? "" : fromAddress;
    replyTo = replyTo == null ? "" : replyTo;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(15) : readTimeout;
  }

  public boolean configured() {
    return !apiKey.isBlank() && !fromAddress.isBlank();
  }
}
