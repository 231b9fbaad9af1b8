package com.example.dispatch.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

/** /stats の本体。各サブチェックは失敗しても error を持って返る。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DispatchStats(
    String worker,
    RecentActivity recentActivity,
    DeliveryAnalytics deliveryAnalytics,
    SystemHealth systemHealth,
    long ledgerWriteFailures,
    List<StatsAlert> alerts) {

  public DispatchStats {
    alerts = alerts == null ? List.of() : List.copyOf(alerts);
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record RecentActivity(Map<String, Long> counts, String error) {

    public RecentActivity {
      counts = counts == null ? Map.of() : Map.copyOf(counts);
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record DeliveryAnalytics(
      long total, long sent, long failed, double successRate, String error) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record SystemHealth(
      ComponentHealth dataStore,
      ComponentHealth transport,
      ComponentHealth cache,
      String overallStatus) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ComponentHealth(String status, String error) {

    public static ComponentHealth of(String status) {
      return new ComponentHealth(status, null);
    }

    public boolean healthy() {
      return "healthy".equals(status) || "configured".equals(status);
    }
  }
}
