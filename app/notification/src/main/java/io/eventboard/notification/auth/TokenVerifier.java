package io.eventboard.notification.auth;

/**
 * Resolves a bearer token to the user it was issued for.
 *
 * <p>Used both for the WebSocket handshake and for the read-side HTTP API, so a user id is always
 * resolved the same way.
 *
 * @throws AuthenticationFailedException when the token is missing, rejected or cannot be checked
 */
public interface TokenVerifier {

  String verify(String token);
}
