package com.example.dispatch.service;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.dispatch.activity.ActivityType;
import com.example.dispatch.activity.WorkerActivityRecorder;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DigestDispatchWorkerTest {

  @Mock private BatchDispatcher dispatcher;
  @Mock private WorkerActivityRecorder activityRecorder;

  @InjectMocks private DigestDispatchWorker worker;

  @Test
  void recordsTriggerAndRunsDispatch() {
    when(dispatcher.dispatchScheduled())
        .thenReturn(
            DispatchReport.aborted("run-1", "db down", List.of("08:00", "07:00"), false, 5));

    worker.run();

    verify(activityRecorder).record(ActivityType.CRON_TRIGGERED);
    verify(dispatcher).dispatchScheduled();
  }

  @Test
  void unexpectedFailureIsRecordedAndSwallowed() {
    when(dispatcher.dispatchScheduled()).thenThrow(new IllegalStateException("boom"));

    worker.run();

    verify(activityRecorder).record(ActivityType.CRITICAL_ERROR);
  }
}
