package com.example.dispatch.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecipientDeliveryResult(
    String recipientId,
    DeliveryOutcome outcome,
    String reason,
    String messageId,
    String error,
    Integer attempts) {

  public static RecipientDeliveryResult sent(String recipientId, String messageId, int attempts) {
    return new RecipientDeliveryResult(
        recipientId, DeliveryOutcome.SENT, null, messageId, null, attempts);
  }

  public static RecipientDeliveryResult skipped(String recipientId, SkipReason reason) {
    return new RecipientDeliveryResult(
        recipientId, DeliveryOutcome.SKIPPED, reason.value(), null, null, null);
  }

  public static RecipientDeliveryResult failed(
      String recipientId, DeliveryFailureReason reason, String error, Integer attempts) {
    return new RecipientDeliveryResult(
        recipientId, DeliveryOutcome.FAILED, reason.value(), null, error, attempts);
  }
}
