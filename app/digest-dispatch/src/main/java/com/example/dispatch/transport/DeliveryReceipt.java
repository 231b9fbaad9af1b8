package com.example.dispatch.transport;

/** 送信 API が受理したメッセージの識別子。 */
public record DeliveryReceipt(String messageId) {}
