package com.example.dispatch.api;

public record HealthResponse(String status, String worker, String version, String timestamp) {}
