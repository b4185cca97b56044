/*
 * Where: Notification service layer
 * What: Applies the retention policy to notifications, dead letters and topic owners
 * Why: Prevent unbounded growth of tables that only ever receive inserts
 */
package io.eventboard.notification.service;

import io.eventboard.notification.config.NotificationRetentionProperties;
import io.eventboard.notification.repository.NotificationDeadLetterRepository;
import io.eventboard.notification.repository.NotificationRepository;
import io.eventboard.notification.repository.TopicOwnerRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationRepository notificationRepository;
  private final NotificationDeadLetterRepository deadLetterRepository;
  private final TopicOwnerRepository topicOwnerRepository;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  @Transactional
  public RetentionResult cleanup() {
    final Instant threshold =
        Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int deletedNotifications = notificationRepository.deleteOlderThan(threshold);
    final int deletedDeadLetters = deadLetterRepository.deleteOlderThan(threshold);
    final int deletedTopicOwners = topicOwnerRepository.deleteOlderThan(threshold);
    logger.info(
        "notification retention cleanup deleted notifications={} deadLetters={} topicOwners={}"
            + " threshold={}",
        deletedNotifications,
        deletedDeadLetters,
        deletedTopicOwners,
        threshold);
    return new RetentionResult(deletedNotifications, deletedDeadLetters, deletedTopicOwners);
  }

  public record RetentionResult(int notifications, int deadLetters, int topicOwners) {}
}
