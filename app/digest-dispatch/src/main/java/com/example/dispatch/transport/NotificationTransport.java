/*
 * どこで: Digest Dispatch 送信層
 * 何を: ダイジェスト本文を宛先へ送る手段を抽象化する
 * なぜ: 実送信とローカル送信(ログ出力)を設定で差し替えるため
 */
package com.example.dispatch.transport;

import com.example.dispatch.content.DigestContent;

public interface NotificationTransport {

  /**
   * 1 通送信する。
   *
   * @throws TransportException 送信 API が失敗を返した、または到達できない場合
   */
  DeliveryReceipt send(DigestContent content, String address);

  /** 実送信に必要な設定が揃っているか。stats のヘルス表示に使う。 */
  boolean configured();
}
