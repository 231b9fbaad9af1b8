/*
 * どこで: Digest Dispatch 制御 API
 * 何を: 認証とレート制限の対象となるエンドポイントを列挙する
 * なぜ: セキュリティ設定・フィルタ・レート制限で対象判定をそろえるため
 */
package com.example.dispatch.security;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

public enum ControlEndpoint {
  TRIGGER_EMAILS("POST", "/trigger-emails", "trigger-emails"),
  TEST_EMAIL("GET", "/test-email", "test-email"),
  STATS("GET", "/stats", "stats");

  private final String method;
  private final String path;
  private final String rateLimitKey;

  ControlEndpoint(String method, String path, String rateLimitKey) {
    this.method = method;
    this.path = path;
    this.rateLimitKey = rateLimitKey;
  }

  public String method() {
    return method;
  }

  public String path() {
    return path;
  }

  /** レート制限の上限設定とキーに使う名前。 */
  public String rateLimitKey() {
    return rateLimitKey;
  }

  public static Optional<ControlEndpoint> match(HttpServletRequest request) {
    return match(request.getMethod(), request.getRequestURI());
  }

  public static Optional<ControlEndpoint> match(String method, String path) {
    for (ControlEndpoint endpoint : values()) {
      if (endpoint.method.equals(method) && endpoint.path.equals(path)) {
        return Optional.of(endpoint);
      }
    }
    return Optional.empty();
  }
}
