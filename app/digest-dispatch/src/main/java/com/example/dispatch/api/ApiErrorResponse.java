/*
 * どこで: Digest Dispatch API
 * 何を: エラー応答の JSON 形状を定義する
 * なぜ: 例外ハンドラ・認証・レート制限で同じフィールド名を使うため
 */
package com.example.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiErrorResponse(
    Boolean success,
    String error,
    String message,
    String path,
    Long retryAfter,
    String timestamp) {

  public static ApiErrorResponse unauthorized(String error, String message) {
    return new ApiErrorResponse(null, error, message, null, null, null);
  }

  public static ApiErrorResponse methodNotAllowed(String error) {
    return new ApiErrorResponse(null, error, null, null, null, null);
  }

  public static ApiErrorResponse notFound(String path) {
    return new ApiErrorResponse(null, "Not found", null, path, null, null);
  }

  public static ApiErrorResponse rateLimited(long retryAfterSeconds) {
    return new ApiErrorResponse(null, "Rate limit exceeded", null, null, retryAfterSeconds, null);
  }

  public static ApiErrorResponse payloadTooLarge(long maxKilobytes) {
    return new ApiErrorResponse(
        null,
        "Request too large. Maximum " + maxKilobytes + "KB allowed.",
        null,
        null,
        null,
        null);
  }

  public static ApiErrorResponse internal(String error, String timestamp) {
    return new ApiErrorResponse(false, error, null, null, null, timestamp);
  }
}
