/*
 * どこで: Digest Dispatch 定期実行
 * 何を: cron に従って配信ランを起動する
 * なぜ: 外部トリガーが無くても毎時の配信を回すため(重複起動は台帳で吸収する)
 */
package com.example.dispatch.service;

import com.example.dispatch.activity.ActivityType;
import com.example.dispatch.activity.WorkerActivityRecorder;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "digest.dispatch.scheduler-enabled", havingValue = "true")
public class DigestDispatchWorker {

  private static final Logger logger = LoggerFactory.getLogger(DigestDispatchWorker.class);

  private final BatchDispatcher dispatcher;
  private final WorkerActivityRecorder activityRecorder;

  @Scheduled(cron = "${digest.dispatch.cron:0 0 * * * *}")
  public void run() {
    activityRecorder.record(ActivityType.CRON_TRIGGERED);
    try {
      final DispatchReport report = dispatcher.dispatchScheduled();
      if (!report.success()) {
        logger.warn("scheduled dispatch aborted runId={} error={}", report.runId(), report.error());
      }
    } catch (RuntimeException ex) {
      // 次回の tick を止めないため、例外はここで記録して握る
      logger.error("scheduled dispatch failed", ex);
      activityRecorder.record(ActivityType.CRITICAL_ERROR);
    }
  }
}
