package io.eventboard.notification.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.eventboard.notification.config.AuthClientProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class RemoteTokenVerifierTest {

  private static final String BASE_URL = "http://auth.test";

  private MockRestServiceServer server;
  private RemoteTokenVerifier verifier;

  @BeforeEach
  void setUp() {
    final RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    verifier =
        new RemoteTokenVerifier(
            builder.build(), new AuthClientProperties(BASE_URL, null, null, null));
  }

  @Test
  void returnsUserIdFromAuthService() {
    server
        .expect(requestTo(BASE_URL + "/auth/me"))
        .andExpect(method(HttpMethod.GET))
        .andExpect(header("Authorization", "Bearer token-1"))
        .andRespond(withSuccess("{\"user_id\":\"u1\"}", MediaType.APPLICATION_JSON));

    assertThat(verifier.verify(" token-1 ")).isEqualTo("u1");
    server.verify();
  }

  @Test
  void missingTokenIsRejectedWithoutCallingAuthService() {
    assertThatThrownBy(() -> verifier.verify(" "))
        .isInstanceOf(AuthenticationFailedException.class)
        .extracting(ex -> ((AuthenticationFailedException) ex).reason())
        .isEqualTo(AuthenticationFailedException.Reason.MISSING_TOKEN);
    server.verify();
  }

  @Test
  void unauthorizedResponseMeansInvalidToken() {
    server.expect(requestTo(BASE_URL + "/auth/me")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertReason("token-1", AuthenticationFailedException.Reason.INVALID_TOKEN);
  }

  @Test
  void serverErrorMeansUnavailable() {
    server.expect(requestTo(BASE_URL + "/auth/me")).andRespond(withServerError());

    assertReason("token-1", AuthenticationFailedException.Reason.UNAVAILABLE);
  }

  @Test
  void blankUserIdIsInvalidResponse() {
    server
        .expect(requestTo(BASE_URL + "/auth/me"))
        .andRespond(withSuccess("{\"user_id\":\" \"}", MediaType.APPLICATION_JSON));

    assertReason("token-1", AuthenticationFailedException.Reason.INVALID_RESPONSE);
  }

  @Test
  void unparsableBodyIsInvalidResponse() {
    server
        .expect(requestTo(BASE_URL + "/auth/me"))
        .andRespond(withSuccess("{not json", MediaType.APPLICATION_JSON));

    assertReason("token-1", AuthenticationFailedException.Reason.INVALID_RESPONSE);
  }

  private void assertReason(String token, AuthenticationFailedException.Reason expected) {
    assertThatThrownBy(() -> verifier.verify(token))
        .isInstanceOf(AuthenticationFailedException.class)
        .extracting(ex -> ((AuthenticationFailedException) ex).reason())
        .isEqualTo(expected);
    server.verify();
  }
}
