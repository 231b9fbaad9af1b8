package com.example.dispatch.api;

import com.example.dispatch.service.DispatchReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TriggerResponse(
    boolean success, String message, String duration, DispatchReport result) {}
