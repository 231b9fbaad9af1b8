package com.example.dispatch.ledger;

/**
 * 送信済み判定の結果。
 *
 * @param degraded キャッシュまたは台帳の読み取りに失敗した場合 true
 */
public record LedgerCheck(boolean delivered, LedgerSource source, boolean degraded) {}
