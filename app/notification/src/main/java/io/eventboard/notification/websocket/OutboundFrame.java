package io.eventboard.notification.websocket;

/** One queued write. Pings travel through the same queue so they never race a text frame. */
public record OutboundFrame(Kind kind, String payload) {

  private static final OutboundFrame PING = new OutboundFrame(Kind.PING, null);

  public enum Kind {
    TEXT,
    PING
  }

  public static OutboundFrame text(String payload) {
    return new OutboundFrame(Kind.TEXT, payload);
  }

  public static OutboundFrame ping() {
    return PING;
  }
}
