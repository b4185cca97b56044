/*
 * Where: Notification application configuration binding
 * What: Holds retention cleanup settings for notifications, dead letters and topic owners
 * Why: Keep retention policy and schedule tunable per environment
 */
package io.eventboard.notification.config;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.retention")
@Validated
public record NotificationRetentionProperties(
    boolean enabled, @Positive int retentionDays, Duration cleanupInterval) {}
