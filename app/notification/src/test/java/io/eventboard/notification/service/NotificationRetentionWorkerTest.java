package io.eventboard.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class NotificationRetentionWorkerTest {

  @Mock private NotificationRetentionService retentionService;

  @Test
  void runsCleanupUnderTraceIdAndClearsIt() {
    final AtomicReference<String> traceIdDuringCleanup = new AtomicReference<>();
    when(retentionService.cleanup())
        .thenAnswer(
            invocation -> {
              traceIdDuringCleanup.set(MDC.get("trace_id"));
              return new NotificationRetentionService.RetentionResult(0, 0, 0);
            });

    new NotificationRetentionWorker(retentionService).run();

    assertThat(traceIdDuringCleanup.get()).isNotBlank();
    assertThat(MDC.get("trace_id")).isNull();
  }
}
