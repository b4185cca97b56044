package io.eventboard.notification.api;

public record UnreadCountResponse(long count) {}
