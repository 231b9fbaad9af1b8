package com.example.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TestEmailResponse(
    boolean success, String message, String error, String duration, String userId) {

  public static TestEmailResponse missingUserId() {
    return new TestEmailResponse(false, null, "userId parameter required", null, null);
  }
}
