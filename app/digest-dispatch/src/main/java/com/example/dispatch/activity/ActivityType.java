package com.example.dispatch.activity;

import java.util.Locale;

public enum ActivityType {
  CRON_TRIGGERED,
  MANUAL_TRIGGER,
  TEST_EMAIL,
  NO_RECIPIENTS,
  PROCESSING_STARTED,
  PROCESSING_COMPLETED,
  CRITICAL_ERROR,
  TEST_EMAIL_SENT,
  TEST_EMAIL_ERROR;

  /** 永続化と stats 表示に使う小文字の値。 */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
