/*
 * どこで: Digest Dispatch 運用記録
 * 何を: 配信ランの開始/完了/異常などを worker_activity_log に残す
 * なぜ: 記録の失敗で配信結果が変わらないよう、例外をここで吸収するため
 */
package com.example.dispatch.activity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WorkerActivityRecorder {

  private static final Logger logger = LoggerFactory.getLogger(WorkerActivityRecorder.class);

  private final WorkerActivityRepository repository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public void record(ActivityType type, Map<String, ?> details) {
    try {
      final String detailsJson =
          details == null || details.isEmpty() ? null : objectMapper.writeValueAsString(details);
      repository.insert(UUID.randomUUID(), type.value(), detailsJson, Instant.now(clock));
    } catch (JsonProcessingException | RuntimeException ex) {
      logger.warn("worker activity record failed type={}", type.value(), ex);
    }
  }

  public void record(ActivityType type) {
    record(type, Map.of());
  }
}
