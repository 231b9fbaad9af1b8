package com.example.dispatch.recipient;

/** digest_settings と recipient_profiles を結合した生の行。 */
public record RecipientRow(
    String recipientId,
    String scheduledSlot,
    String contentPreferences,
    String contactAddress,
    String displayName,
    String businessName) {}
