package io.eventboard.notification.auth;

public class AuthenticationFailedException extends RuntimeException {

  public enum Reason {
    MISSING_TOKEN,
    INVALID_TOKEN,
    UNAVAILABLE,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public AuthenticationFailedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public AuthenticationFailedException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
