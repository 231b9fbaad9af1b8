package com.example.dispatch.ratelimit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Redis に保存するウィンドウ。requests はリクエスト時刻(epoch 秒)の昇順。 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RateLimitWindow(List<Long> requests, long lastUpdated) {

  public RateLimitWindow {
    requests = requests == null ? List.of() : List.copyOf(requests);
  }
}
