/*
 * Where: Notification cleanup worker
 * What: Triggers retention cleanup on a schedule under its own trace id
 */
package io.eventboard.notification.service;

import io.eventboard.common.TraceIds;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.retention.enabled", havingValue = "true")
public class NotificationRetentionWorker {

  private final NotificationRetentionService retentionService;

  @Scheduled(
      initialDelayString = "${notification.retention.cleanup-interval}",
      fixedDelayString = "${notification.retention.cleanup-interval}")
  public void run() {
    try (MDC.MDCCloseable ignored = MDC.putCloseable("trace_id", TraceIds.newTraceId())) {
      retentionService.cleanup();
    }
  }
}
