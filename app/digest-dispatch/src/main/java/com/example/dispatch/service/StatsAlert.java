package com.example.dispatch.service;

/** /stats に載せる運用アラート。severity は warning か critical。 */
public record StatsAlert(String type, String message, String severity) {

  public static final String WARNING = "warning";
  public static final String CRITICAL = "critical";
}
