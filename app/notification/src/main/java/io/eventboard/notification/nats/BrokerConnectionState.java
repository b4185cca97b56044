package io.eventboard.notification.nats;

public enum BrokerConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    CONSUMING,
    RECONNECTING,
    FAILED
}
