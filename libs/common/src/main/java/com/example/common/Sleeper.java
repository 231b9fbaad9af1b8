/*
 * どこで: 共通ユーティリティ
 * 何を: スレッド待機を差し替え可能にする
 * なぜ: バックオフやバッチ間待機をテストで観測・省略できるようにするため
 */
package com.example.common;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(Math.max(0L, duration.toMillis()));

  void sleep(Duration duration) throws InterruptedException;
}
