package com.example.dispatch.recipient;

/** 取り込み時に設定不備として除外された行。recipientId は欠落している場合がある。 */
public record RejectedRecipient(String recipientId, String reason) {}
