package io.eventboard.notification.api;

public record MarkReadResponse(String status, String message) {

  public static MarkReadResponse success(String message) {
    return new MarkReadResponse("success", message);
  }
}
