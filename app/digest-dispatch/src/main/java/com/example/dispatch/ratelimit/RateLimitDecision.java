package com.example.dispatch.ratelimit;

public record RateLimitDecision(boolean allowed, long retryAfterSeconds) {

  public static RateLimitDecision allow() {
    return new RateLimitDecision(true, 0L);
  }

  public static RateLimitDecision reject(long retryAfterSeconds) {
    return new RateLimitDecision(false, retryAfterSeconds);
  }
}
