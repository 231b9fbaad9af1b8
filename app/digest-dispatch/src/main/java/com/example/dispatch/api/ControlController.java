/*
 * どこで: Digest Dispatch API
 * 何を: 手動トリガー・テスト送信・統計・ヘルスを提供する
 * なぜ: 定期実行とは別に運用者が配信を操作・確認できるようにするため
 */
package com.example.dispatch.api;

import com.example.dispatch.activity.ActivityType;
import com.example.dispatch.activity.WorkerActivityRecorder;
import com.example.dispatch.config.DispatchProperties;
import com.example.dispatch.service.BatchDispatcher;
import com.example.dispatch.service.DispatchReport;
import com.example.dispatch.service.DispatchStatsService;
import com.example.dispatch.service.SingleDispatchResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class ControlController {

  static final String VERSION = "1.0.0";

  private static final Logger logger = LoggerFactory.getLogger(ControlController.class);

  private final BatchDispatcher dispatcher;
  private final DispatchStatsService statsService;
  private final WorkerActivityRecorder activityRecorder;
  private final DispatchProperties properties;
  private final Clock clock;

  @PostMapping("/trigger-emails")
  public ResponseEntity<TriggerResponse> triggerEmails() {
    final Instant startedAt = Instant.now(clock);
    logger.info("manual dispatch triggered");
    activityRecorder.record(ActivityType.MANUAL_TRIGGER);
    final DispatchReport report = dispatcher.dispatchScheduled();
    final String message =
        report.success() ? "Email processing completed" : "Email processing aborted";
    return ResponseEntity.ok(
        new TriggerResponse(report.success(), message, elapsed(startedAt), report));
  }

  @GetMapping("/test-email")
  public ResponseEntity<TestEmailResponse> testEmail(
      @RequestParam(name = "userId", required = false) String userId) {
    if (userId == null || userId.isBlank()) {
      return ResponseEntity.badRequest().body(TestEmailResponse.missingUserId());
    }
    final Instant startedAt = Instant.now(clock);
    final SingleDispatchResult result = dispatcher.dispatchSingle(userId);
    final TestEmailResponse body =
        new TestEmailResponse(
            result.success(), result.message(), null, elapsed(startedAt), result.recipientId());
    final HttpStatus status = result.success() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
    return ResponseEntity.status(status).body(body);
  }

  @GetMapping("/stats")
  public StatsResponse stats() {
    return new StatsResponse(true, statsService.collect(), Instant.now(clock).toString());
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse(
        "healthy", properties.workerName(), VERSION, Instant.now(clock).toString());
  }

  @GetMapping("/")
  public ServiceInfoResponse info() {
    final Map<String, String> endpoints = new LinkedHashMap<>();
    endpoints.put("POST /trigger-emails", "Run one dispatch over the current delivery window");
    endpoints.put("GET /test-email?userId=<id>", "Send the digest to a single recipient");
    endpoints.put("GET /stats", "Recent activity, delivery analytics and dependency health");
    endpoints.put("GET /health", "Liveness check");
    return new ServiceInfoResponse(properties.workerName(), VERSION, "running", endpoints);
  }

  private String elapsed(Instant startedAt) {
    return Math.max(0L, Duration.between(startedAt, Instant.now(clock)).toMillis()) + "ms";
  }
}
