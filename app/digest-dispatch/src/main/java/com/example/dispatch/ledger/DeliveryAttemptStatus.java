package com.example.dispatch.ledger;

public enum DeliveryAttemptStatus {
  SENT,
  FAILED
}
