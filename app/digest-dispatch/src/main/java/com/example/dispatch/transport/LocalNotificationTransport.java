/*
 * どこで: Digest Dispatch 送信層
 * 何を: ローカル送信としてログ出力のみ行う
 * なぜ: 送信 API なしで配信フローを動作確認するため
 */
package com.example.dispatch.transport;

import com.example.dispatch.content.DigestContent;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "digest.transport.mode", havingValue = "local", matchIfMissing = true)
public class LocalNotificationTransport implements NotificationTransport {

  private static final Logger logger = LoggerFactory.getLogger(LocalNotificationTransport.class);

  @Override
  public DeliveryReceipt send(DigestContent content, String address) {
    final String messageId = "local-" + UUID.randomUUID();
    logger.info(
        "digest delivered locally messageId={} address={} subject={}",
        messageId,
        address,
        content.subject());
    return new DeliveryReceipt(messageId);
  }

  @Override
  public boolean configured() {
    return true;
  }
}
