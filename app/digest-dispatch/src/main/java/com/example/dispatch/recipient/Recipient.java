/*
 * どこで: Digest Dispatch 受信者
 * 何を: 配信対象として取り込んだ受信者設定とプロファイルを表す
 * なぜ: 配信パイプラインが生の DB 行に依存しないようにするため
 */
package com.example.dispatch.recipient;

import java.util.List;

public record Recipient(
    String recipientId,
    String scheduledSlot,
    List<String> contentPreferences,
    String contactAddress,
    String displayName,
    String businessName) {

  public Recipient {
    contentPreferences = contentPreferences == null ? List.of() : List.copyOf(contentPreferences);
  }

  public boolean hasContact() {
    return recipientId != null
        && !recipientId.isBlank()
        && contactAddress != null
        && !contactAddress.isBlank();
  }
}
