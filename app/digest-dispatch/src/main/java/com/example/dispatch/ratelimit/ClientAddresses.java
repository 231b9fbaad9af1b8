package com.example.dispatch.ratelimit;

import jakarta.servlet.http.HttpServletRequest;

/** リクエスト元クライアントの識別キー。プロキシ経由なら X-Forwarded-For の先頭を使う。 */
public final class ClientAddresses {

  public static final String UNKNOWN = "unknown";

  private ClientAddresses() {}

  public static String resolve(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor != null && !xForwardedFor.isBlank()) {
      final int commaIndex = xForwardedFor.indexOf(',');
      final String first =
          commaIndex < 0 ? xForwardedFor.trim() : xForwardedFor.substring(0, commaIndex).trim();
      if (!first.isEmpty()) {
        return first;
      }
    }
    final String remoteAddr = request.getRemoteAddr();
    if (remoteAddr == null || remoteAddr.isBlank()) {
      return UNKNOWN;
    }
    return remoteAddr;
  }
}
