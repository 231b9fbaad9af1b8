package com.example.dispatch.api;

import java.util.Map;

public record ServiceInfoResponse(
    String service, String version, String status, Map<String, String> endpoints) {}
