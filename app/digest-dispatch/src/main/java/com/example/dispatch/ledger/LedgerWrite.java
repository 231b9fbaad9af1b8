package com.example.dispatch.ledger;

public enum LedgerWrite {
  RECORDED,
  DUPLICATE_IGNORED,
  FAILED
}
