package com.example.dispatch.service;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DeliveryOutcome {
  SENT,
  SKIPPED,
  FAILED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
