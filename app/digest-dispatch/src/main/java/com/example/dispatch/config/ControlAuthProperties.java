package com.example.dispatch.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "digest.control.auth")
public record ControlAuthProperties(
    String adminToken,
    String hmacSecret,
    Duration replayWindow,
    String timestampHeaderName,
    String signatureHeaderName) {

  public ControlAuthProperties {
    adminToken = adminToken == null ? "" : adminToken;
    hmacSecret = hmacSecret == null ? "" : hmacSecret;
    replayWindow = replayWindow == null ? Duration.ofSeconds(300) : replayWindow;
    timestampHeaderName =
        timestampHeaderName == null || timestampHeaderName.isBlank()
            ? "X-Timestamp"
            : timestampHeaderName;
    signatureHeaderName =
        signatureHeaderName == null || signatureHeaderName.isBlank()
            ? "X-Signature"
            : signatureHeaderName;
  }

  public boolean hmacEnabled() {
    return !hmacSecret.isBlank();
  }
}
