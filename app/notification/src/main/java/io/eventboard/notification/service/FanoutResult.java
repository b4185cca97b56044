package io.eventboard.notification.service;

import java.util.UUID;

public record FanoutResult(UUID notificationId, int recipients, int delivered) {}
