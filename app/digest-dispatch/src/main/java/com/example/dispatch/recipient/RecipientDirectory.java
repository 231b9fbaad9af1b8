package com.example.dispatch.recipient;

import java.util.List;
import java.util.Optional;

public interface RecipientDirectory {

  /**
   * 指定スロットのいずれかに配信予定の有効な受信者を取得する。
   *
   * @throws RecipientDirectoryException データストアの読み取りに失敗した場合
   */
  EligibleRecipients fetchEligible(List<String> slots);

  /** 有効な配信設定を持つ受信者を ID で引く。スロットは問わない。 */
  Optional<Recipient> findEnabled(String recipientId);

  /** データストアへの疎通確認。 */
  void ping();
}
