package com.example.dispatch.service;

import com.example.dispatch.ledger.LedgerSource;
import java.util.Locale;

public enum SkipReason {
  ALREADY_SENT_CACHED,
  ALREADY_SENT_LEDGER;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static SkipReason from(LedgerSource source) {
    return source == LedgerSource.CACHE ? ALREADY_SENT_CACHED : ALREADY_SENT_LEDGER;
  }
}
