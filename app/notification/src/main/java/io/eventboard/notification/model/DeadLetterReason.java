package io.eventboard.notification.model;

public enum DeadLetterReason {
  DECODE_FAILED,
  MAX_DELIVER,
  TERMINATED
}
