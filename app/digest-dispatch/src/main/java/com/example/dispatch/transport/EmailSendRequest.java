package com.example.dispatch.transport;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EmailSendRequest(
    String sender,
    List<String> to,
    String subject,
    String htmlBody,
    String textBody,
    List<CustomHeader> customHeaders) {

  public record CustomHeader(String header, String value) {}
}
