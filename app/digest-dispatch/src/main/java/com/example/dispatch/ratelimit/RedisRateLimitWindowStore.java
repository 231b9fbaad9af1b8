/*
 * どこで: Digest Dispatch レート制限
 * 何を: エンドポイント×クライアント単位のリクエスト履歴を Redis に JSON で保存する
 * なぜ: 複数インスタンス間で制御 API の呼び出し回数を共有するため
 */
package com.example.dispatch.ratelimit;

import com.example.dispatch.config.RateLimitProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.Optional;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisRateLimitWindowStore implements RateLimitWindowStore {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final ObjectMapper objectMapper;
  private final RateLimitProperties properties;

  public RedisRateLimitWindowStore(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      RateLimitProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public Optional<RateLimitWindow> load(String endpoint, String clientKey) {
    final String raw = redisTemplate.opsForValue().get(windowKey(endpoint, clientKey));
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(raw, RateLimitWindow.class));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("rate limit window is not valid json", ex);
    }
  }

  @Override
  public void save(String endpoint, String clientKey, RateLimitWindow window, Duration ttl) {
    final String json;
    try {
      json = objectMapper.writeValueAsString(window);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("rate limit window serialization failed", ex);
    }
    redisTemplate.opsForValue().set(windowKey(endpoint, clientKey), json, ttl);
  }

  String windowKey(String endpoint, String clientKey) {
    return properties.keyPrefix() + endpoint + ":" + clientKey;
  }
}
