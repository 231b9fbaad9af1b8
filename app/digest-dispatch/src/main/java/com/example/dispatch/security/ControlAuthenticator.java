/*
 * どこで: Digest Dispatch 認証
 * 何を: 管理トークンまたは HMAC 署名で制御リクエストを検証する
 * なぜ: 手動トリガー/テスト送信/統計を運用者だけに開放するため
 */
package com.example.dispatch.security;

import com.example.dispatch.config.ControlAuthProperties;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bearer トークンと HMAC 署名の 2 方式を受け付ける。
 *
 * <p>HMAC はタイムスタンプの許容幅内であれば同じ署名を再送できる。nonce による再送防止は行わない。
 */
@Component
@RequiredArgsConstructor
public class ControlAuthenticator {

  public static final String MISSING_AUTHORIZATION = "Missing Authorization header";
  public static final String INVALID_CREDENTIALS = "Invalid authentication credentials";
  public static final String SYSTEM_ERROR = "Authentication system error";

  private static final Logger logger = LoggerFactory.getLogger(ControlAuthenticator.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final ControlAuthProperties properties;

  public AuthenticationVerdict authenticate(ControlRequest request, Instant now) {
    try {
      return evaluate(request, now);
    } catch (RuntimeException ex) {
      logger.error("authentication failed unexpectedly path={}", request.pathWithQuery(), ex);
      return AuthenticationVerdict.failure(SYSTEM_ERROR);
    }
  }

  private AuthenticationVerdict evaluate(ControlRequest request, Instant now) {
    final String authorization = request.authorizationHeader();
    if (authorization != null && !authorization.isBlank()) {
      final String token =
          authorization.startsWith(BEARER_PREFIX)
              ? authorization.substring(BEARER_PREFIX.length()).trim()
              : authorization.trim();
      if (!properties.adminToken().isBlank() && constantTimeEquals(token, properties.adminToken())) {
        return AuthenticationVerdict.success(AuthenticationMethod.TOKEN);
      }
    }
    if (properties.hmacEnabled() && hasSignatureHeaders(request)) {
      return verifySignature(request, now);
    }
    if (authorization == null || authorization.isBlank()) {
      return AuthenticationVerdict.failure(MISSING_AUTHORIZATION);
    }
    return AuthenticationVerdict.failure(INVALID_CREDENTIALS);
  }

  private AuthenticationVerdict verifySignature(ControlRequest request, Instant now) {
    final long timestamp;
    try {
      timestamp = Long.parseLong(request.timestampHeader().trim());
    } catch (NumberFormatException ex) {
      return AuthenticationVerdict.failure(INVALID_CREDENTIALS);
    }
    final long skew = Math.abs(now.getEpochSecond() - timestamp);
    if (skew > properties.replayWindow().toSeconds()) {
      logger.debug("hmac timestamp outside replay window skewSeconds={}", skew);
      return AuthenticationVerdict.failure(INVALID_CREDENTIALS);
    }
    final String canonical =
        HmacSigner.canonicalString(
            request.method(),
            request.pathWithQuery(),
            request.timestampHeader().trim(),
            request.body());
    final String expected = HmacSigner.sign(properties.hmacSecret(), canonical);
    final String actual = request.signatureHeader().trim().toLowerCase(Locale.ROOT);
    if (constantTimeEquals(expected, actual)) {
      return AuthenticationVerdict.success(AuthenticationMethod.HMAC);
    }
    return AuthenticationVerdict.failure(INVALID_CREDENTIALS);
  }

  private boolean hasSignatureHeaders(ControlRequest request) {
    return request.timestampHeader() != null
        && !request.timestampHeader().isBlank()
        && request.signatureHeader() != null
        && !request.signatureHeader().isBlank();
  }

  private boolean constantTimeEquals(String left, String right) {
    return MessageDigest.isEqual(
        left.getBytes(StandardCharsets.UTF_8), right.getBytes(StandardCharsets.UTF_8));
  }
}
