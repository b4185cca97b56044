package io.eventboard.notification.nats;

import io.eventboard.notification.model.ChangeEnvelope;

/** Outcome of decoding one broker payload. Exactly one of envelope and error is set. */
public record DecodeResult(ChangeEnvelope envelope, String error) {

  public static DecodeResult success(ChangeEnvelope envelope) {
    return new DecodeResult(envelope, null);
  }

  public static DecodeResult failure(String error) {
    return new DecodeResult(null, error);
  }

  public boolean isSuccess() {
    return envelope != null;
  }
}
