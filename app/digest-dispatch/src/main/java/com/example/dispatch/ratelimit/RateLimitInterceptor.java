/*
 * どこで: Digest Dispatch レート制限
 * 何を: 制御エンドポイントの呼び出しをレート判定し、超過時は 429 を返す
 * なぜ: 認証済みでも過剰な手動トリガーを抑止するため
 */
package com.example.dispatch.ratelimit;

import com.example.dispatch.api.ApiErrorResponse;
import com.example.dispatch.security.ControlEndpoint;
import com.example.dispatch.service.DispatchMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {

  private final SlidingWindowRateLimiter rateLimiter;
  private final DispatchMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
      throws IOException {
    final Optional<ControlEndpoint> endpoint = ControlEndpoint.match(request);
    if (endpoint.isEmpty()) {
      return true;
    }
    final String rateLimitKey = endpoint.get().rateLimitKey();
    final RateLimitDecision decision =
        rateLimiter.check(rateLimitKey, ClientAddresses.resolve(request), Instant.now(clock));
    if (decision.allowed()) {
      return true;
    }
    metrics.recordRateLimitRejected(rateLimitKey);
    response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
    response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(decision.retryAfterSeconds()));
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(
        response.getOutputStream(), ApiErrorResponse.rateLimited(decision.retryAfterSeconds()));
    return false;
  }
}
