package com.example.dispatch.service;

import java.util.Locale;

/** 受信者単位の失敗理由。MISSING_CONTACT は設定不備で、リトライしない。 */
public enum DeliveryFailureReason {
  MISSING_CONTACT,
  CONTENT_UNAVAILABLE,
  SEND_FAILED,
  UNEXPECTED_ERROR;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
