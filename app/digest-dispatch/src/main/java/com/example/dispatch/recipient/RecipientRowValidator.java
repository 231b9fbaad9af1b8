/*
 * どこで: Digest Dispatch 受信者
 * 何を: 生の行を Recipient と RejectedRecipient に振り分ける
 * なぜ: 設定不備の行をバッチ処理に入る前に除外し、理由付きで報告するため
 */
package com.example.dispatch.recipient;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

public final class RecipientRowValidator {

  private static final Pattern SLOT_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):00$");

  private RecipientRowValidator() {}

  public static EligibleRecipients classify(List<RecipientRow> rows) {
    final List<Recipient> accepted = new ArrayList<>();
    final List<RejectedRecipient> rejected = new ArrayList<>();
    for (RecipientRow row : rows) {
      final String reason = rejectionReason(row);
      if (reason == null) {
        accepted.add(toRecipient(row));
      } else {
        rejected.add(new RejectedRecipient(row.recipientId(), reason));
      }
    }
    return new EligibleRecipients(accepted, rejected);
  }

  public static Recipient toRecipient(RecipientRow row) {
    return new Recipient(
        row.recipientId(),
        row.scheduledSlot(),
        parsePreferences(row.contentPreferences()),
        trimToNull(row.contactAddress()),
        trimToNull(row.displayName()),
        trimToNull(row.businessName()));
  }

  static String rejectionReason(RecipientRow row) {
    if (isBlank(row.recipientId())) {
      return "missing_recipient_id";
    }
    if (row.scheduledSlot() == null || !SLOT_PATTERN.matcher(row.scheduledSlot()).matches()) {
      return "invalid_scheduled_slot";
    }
    if (isBlank(row.contactAddress())) {
      return "missing_contact";
    }
    return null;
  }

  static List<String> parsePreferences(String raw) {
    if (isBlank(raw)) {
      return List.of();
    }
    return Arrays.stream(raw.split(","))
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .toList();
  }

  private static String trimToNull(String value) {
    return isBlank(value) ? null : value.trim();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
