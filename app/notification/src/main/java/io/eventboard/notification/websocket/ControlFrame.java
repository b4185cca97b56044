package io.eventboard.notification.websocket;

/** Client to server frame. {@code eventId} is null for {@link Action#PING}. */
public record ControlFrame(Action action, String eventId) {

  public enum Action {
    SUBSCRIBE,
    UNSUBSCRIBE,
    PING
  }
}
