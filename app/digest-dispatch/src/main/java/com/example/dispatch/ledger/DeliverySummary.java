package com.example.dispatch.ledger;

public record DeliverySummary(long total, long sent, long failed) {

  public static DeliverySummary empty() {
    return new DeliverySummary(0, 0, 0);
  }
}
