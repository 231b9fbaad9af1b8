package com.example.dispatch.security;

/**
 * 認証判定に必要なリクエスト要素。
 *
 * @param pathWithQuery パスとクエリ文字列(例: {@code /test-email?userId=u1})
 * @param body リクエストボディ。GET では空文字として署名する
 */
public record ControlRequest(
    String method,
    String pathWithQuery,
    String authorizationHeader,
    String timestampHeader,
    String signatureHeader,
    String body) {}
