package io.eventboard.notification.websocket;

public enum ConnectionState {
  CONNECTING,
  ACTIVE,
  CLOSING,
  CLOSED
}
