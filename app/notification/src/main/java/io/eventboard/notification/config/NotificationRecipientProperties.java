/*
 * Where: Notification application configuration binding
 * What: Switches for the recipient policy
 * Why: Broadcasting created events to every online user is a deployment decision
 */
package io.eventboard.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.recipients")
public record NotificationRecipientProperties(boolean broadcastCreated) {}
