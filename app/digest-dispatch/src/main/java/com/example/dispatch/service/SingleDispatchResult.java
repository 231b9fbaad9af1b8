package com.example.dispatch.service;

/** 単一受信者へのテスト配信の結果。スキップは失敗として扱う。 */
public record SingleDispatchResult(
    boolean success, String message, String recipientId, String messageId) {}
