package com.example.dispatch.ratelimit;

import java.time.Duration;
import java.util.Optional;

public interface RateLimitWindowStore {

  Optional<RateLimitWindow> load(String endpoint, String clientKey);

  void save(String endpoint, String clientKey, RateLimitWindow window, Duration ttl);
}
