package com.example.dispatch.recipient;

import java.util.List;

public record EligibleRecipients(List<Recipient> accepted, List<RejectedRecipient> rejected) {

  public EligibleRecipients {
    accepted = accepted == null ? List.of() : List.copyOf(accepted);
    rejected = rejected == null ? List.of() : List.copyOf(rejected);
  }

  public static EligibleRecipients empty() {
    return new EligibleRecipients(List.of(), List.of());
  }
}
