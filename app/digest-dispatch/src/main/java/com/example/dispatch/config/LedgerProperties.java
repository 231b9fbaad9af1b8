package com.example.dispatch.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "digest.ledger")
public record LedgerProperties(Duration cacheTtl, String cacheKeyPrefix) {

  public LedgerProperties {
    cacheTtl = cacheTtl == null ? Duration.ofHours(24) : cacheTtl;
    cacheKeyPrefix =
        cacheKeyPrefix == null || cacheKeyPrefix.isBlank() ? "digest:sent:" : cacheKeyPrefix;
  }
}
