package com.codeheadsystems.suitekey.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.suitekey.server.scope.AuthorizationScope;
import com.codeheadsystems.suitekey.server.state.AuthorizationState;
import com.codeheadsystems.suitekey.server.state.StateTokenManager;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration tests for the sign-in flow over real HTTP.
 * Tests the full flow: login → consent redirect → callback → token → logout, with the
 * provider's token endpoint replaced by {@link FakeTokenEndpoint}.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class AuthorizationIntegrationTest {

  static final DropwizardAppExtension<SuitekeyConfiguration> APP =
      new DropwizardAppExtension<>(
          SuitekeyApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final String SHEETS_SCOPE = "https://www.googleapis.com/auth/spreadsheets";
  private static final String DOCS_SCOPE = "https://www.googleapis.com/auth/documents";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private HttpClient httpClient;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build();
  }

  @Test
  void login_redirectsToConsentAndSetsCookie() throws Exception {
    HttpResponse<String> response = get("/auth/login?agents=sheets,docs", null);

    assertThat(response.statusCode()).isEqualTo(303);
    URI location = URI.create(response.headers().firstValue("Location").orElseThrow());
    assertThat(location.getHost()).isEqualTo("accounts.google.com");
    Map<String, String> params = query(location);
    assertThat(params)
        .containsEntry("client_id", "test-client-id")
        .containsEntry("redirect_uri", "http://localhost/auth/callback")
        .containsEntry("scope", DOCS_SCOPE + " " + SHEETS_SCOPE)
        .containsEntry("access_type", "offline")
        .containsKey("state");
    assertThat(response.body()).doesNotContain("test-client-secret");
    assertThat(sessionCookie(response)).isNotBlank();
    assertThat(response.headers().firstValue("Set-Cookie").orElseThrow()).containsIgnoringCase("HttpOnly");
  }

  @Test
  void fullFlow_loginCallbackTokenReplayLogout() throws Exception {
    HttpResponse<String> login = get("/auth/login?agents=sheets", null);
    String cookie = sessionCookie(login);
    String state = query(URI.create(login.headers().firstValue("Location").orElseThrow())).get("state");

    HttpResponse<String> callback = get("/auth/callback?state=" + encode(state) + "&code=good-code", cookie);
    assertThat(callback.statusCode()).isEqualTo(200);
    JsonNode complete = objectMapper.readTree(callback.body());
    assertThat(complete.get("grantedScopes").toString()).contains(SHEETS_SCOPE);
    assertThat(callback.body()).doesNotContain("access-good-code").doesNotContain("refresh-good-code");

    HttpResponse<String> token = get("/auth/token?agents=sheets", cookie);
    assertThat(token.statusCode()).isEqualTo(200);
    assertThat(objectMapper.readTree(token.body()).get("accessToken").asText()).isEqualTo("access-good-code");
    assertThat(token.body()).doesNotContain("refresh-good-code");

    HttpResponse<String> replay = get("/auth/callback?state=" + encode(state) + "&code=good-code", cookie);
    assertThat(replay.statusCode()).isEqualTo(401);

    HttpResponse<String> moreScopes = get("/auth/token?agents=sheets,docs", cookie);
    assertThat(moreScopes.statusCode()).isEqualTo(401);
    JsonNode needs = objectMapper.readTree(moreScopes.body());
    assertThat(needs.get("error").asText()).isEqualTo("insufficient_scope");
    assertThat(query(URI.create(needs.get("redirectUrl").asText())))
        .containsEntry("scope", DOCS_SCOPE + " " + SHEETS_SCOPE);

    HttpResponse<String> logout = post("/auth/logout", cookie);
    assertThat(logout.statusCode()).isEqualTo(204);
    assertThat(SuitekeyApplication.TOKEN_ENDPOINT.revoked()).contains("refresh-good-code");

    HttpResponse<String> afterLogout = get("/auth/token?agents=sheets", cookie);
    assertThat(afterLogout.statusCode()).isEqualTo(401);
    assertThat(objectMapper.readTree(afterLogout.body()).get("error").asText()).isEqualTo("no_credential");
  }

  @Test
  void callback_withReturnTo_redirects() throws Exception {
    HttpResponse<String> login = get("/auth/login?agents=tasks&returnTo=%2Fdone", null);
    String state = query(URI.create(login.headers().firstValue("Location").orElseThrow())).get("state");

    HttpResponse<String> callback = get("/auth/callback?state=" + encode(state) + "&code=c2", sessionCookie(login));

    assertThat(callback.statusCode()).isEqualTo(303);
    assertThat(callback.headers().firstValue("Location").orElseThrow()).endsWith("/done");
  }

  @Test
  void login_externalReturnTo_isBadRequest() throws Exception {
    HttpResponse<String> response = get("/auth/login?agents=sheets&returnTo=https%3A%2F%2Fevil.example", null);

    assertThat(response.statusCode()).isEqualTo(400);
  }

  @Test
  void login_unknownAgent_isBadRequest() throws Exception {
    HttpResponse<String> response = get("/auth/login?agents=fax", null);

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(response.body()).contains("fax");
  }

  @Test
  void callback_forgedState_isUnauthorized() throws Exception {
    HttpResponse<String> response = get("/auth/callback?state=forged&code=good-code", null);

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.body()).contains("Please sign in again");
  }

  @Test
  void callback_rejectedCode_isUnauthorized() throws Exception {
    HttpResponse<String> login = get("/auth/login?agents=sheets", null);
    String state = query(URI.create(login.headers().firstValue("Location").orElseThrow())).get("state");

    HttpResponse<String> response = get("/auth/callback?state=" + encode(state)
        + "&code=" + FakeTokenEndpoint.REJECTED_CODE, sessionCookie(login));

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void callback_accessDenied_isUnauthorized() throws Exception {
    HttpResponse<String> login = get("/auth/login?agents=sheets", null);
    String state = query(URI.create(login.headers().firstValue("Location").orElseThrow())).get("state");

    HttpResponse<String> response = get("/auth/callback?state=" + encode(state) + "&error=access_denied",
        sessionCookie(login));

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void token_withoutCookie_pointsAtLoginWithoutCreatingState() throws Exception {
    int pendingBefore = SuitekeyApplication.STATE_STORE.size();

    HttpResponse<String> response = get("/auth/token?agents=drive", null);

    assertThat(response.statusCode()).isEqualTo(401);
    JsonNode body = objectMapper.readTree(response.body());
    assertThat(body.get("error").asText()).isEqualTo("no_credential");
    assertThat(body.get("redirectUrl").asText()).isEqualTo("/auth/login?agents=drive");
    assertThat(sessionCookie(response)).isNull();
    assertThat(SuitekeyApplication.STATE_STORE.size()).isEqualTo(pendingBefore);
  }

  @Test
  void callback_fromAnotherSession_isUnauthorizedAndStoresNothing() throws Exception {
    HttpResponse<String> attackerLogin = get("/auth/login?agents=sheets", null);
    String attackerCookie = sessionCookie(attackerLogin);
    String state = query(URI.create(attackerLogin.headers().firstValue("Location").orElseThrow())).get("state");
    String victimCookie = sessionCookie(get("/auth/login?agents=sheets", null));

    HttpResponse<String> victimCallback = get("/auth/callback?state=" + encode(state) + "&code=victim-code",
        victimCookie);
    assertThat(victimCallback.statusCode()).isEqualTo(401);

    HttpResponse<String> attackerToken = get("/auth/token?agents=sheets", attackerCookie);
    assertThat(attackerToken.statusCode()).isEqualTo(401);
    assertThat(attackerToken.body()).doesNotContain("access-victim-code");
    HttpResponse<String> victimToken = get("/auth/token?agents=sheets", victimCookie);
    assertThat(victimToken.statusCode()).isEqualTo(401);
  }

  @Test
  void callback_withoutCookie_isUnauthorized() throws Exception {
    HttpResponse<String> login = get("/auth/login?agents=sheets", null);
    String state = query(URI.create(login.headers().firstValue("Location").orElseThrow())).get("state");

    HttpResponse<String> response = get("/auth/callback?state=" + encode(state) + "&code=good-code", null);

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void pendingStatesAtCap_loginAndTokenAreUnavailable() throws Exception {
    String cookie = sessionCookie(get("/auth/login?agents=sheets", null));
    try {
      for (int i = SuitekeyApplication.STATE_STORE.size(); i < StateTokenManager.MAX_PENDING_STATES; i++) {
        SuitekeyApplication.STATE_STORE.store(new AuthorizationState("filler-" + i, "filler",
            AuthorizationScope.setOf("a"), Instant.now(), null, false));
      }

      assertThat(get("/auth/login?agents=sheets", cookie).statusCode()).isEqualTo(503);
      HttpResponse<String> token = get("/auth/token?agents=sheets", cookie);
      assertThat(token.statusCode()).isEqualTo(503);
      assertThat(objectMapper.readTree(token.body()).get("error").asText()).isEqualTo("unavailable");
    } finally {
      SuitekeyApplication.STATE_STORE.removeCreatedBefore(Instant.now().plusSeconds(3600));
    }
  }

  @Test
  void delegatedToken_returnsRefreshedToken() throws Exception {
    HttpResponse<String> response = get("/auth/delegated-token", null);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(objectMapper.readTree(response.body()).get("accessToken").asText())
        .isEqualTo("refreshed-delegated-refresh-token");
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private HttpResponse<String> get(String path, String cookie) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(baseUrl() + path)).GET();
    if (cookie != null) {
      builder.header("Cookie", "SUITEKEY_SESSION=" + cookie);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> post(String path, String cookie) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .POST(HttpRequest.BodyPublishers.noBody());
    if (cookie != null) {
      builder.header("Cookie", "SUITEKEY_SESSION=" + cookie);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private static String sessionCookie(HttpResponse<String> response) {
    return response.headers().allValues("Set-Cookie").stream()
        .filter(h -> h.startsWith("SUITEKEY_SESSION="))
        .map(h -> h.substring("SUITEKEY_SESSION=".length()).split(";", 2)[0])
        .findFirst()
        .orElse(null);
  }

  private static Map<String, String> query(URI uri) {
    Map<String, String> params = new LinkedHashMap<>();
    for (String pair : uri.getRawQuery().split("&")) {
      int eq = pair.indexOf('=');
      params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
          URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
    }
    return params;
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static String baseUrl() {
    return "http://localhost:" + APP.getLocalPort();
  }
}
