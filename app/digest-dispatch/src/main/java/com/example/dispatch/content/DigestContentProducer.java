package com.example.dispatch.content;

import com.example.dispatch.recipient.Recipient;
import java.time.LocalDate;

public interface DigestContentProducer {

  /**
   * 受信者向けの本文を生成する。
   *
   * @throws ContentProductionException 生成できない場合。リトライ対象外
   */
  DigestContent produce(Recipient recipient, LocalDate deliveryDay);
}
