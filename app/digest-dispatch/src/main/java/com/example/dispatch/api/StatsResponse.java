package com.example.dispatch.api;

import com.example.dispatch.service.DispatchStats;

public record StatsResponse(boolean success, DispatchStats stats, String timestamp) {}
