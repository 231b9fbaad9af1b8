package com.example.dispatch.ledger;

public enum LedgerSource {
  CACHE,
  LEDGER,
  NONE
}
