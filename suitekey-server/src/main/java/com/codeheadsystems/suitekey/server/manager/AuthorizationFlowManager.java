package com.codeheadsystems.suitekey.server.manager;

import com.codeheadsystems.suitekey.model.oauth.TokenResponse;
import com.codeheadsystems.suitekey.server.auth.Session;
import com.codeheadsystems.suitekey.server.exceptions.ExchangeFailedException;
import com.codeheadsystems.suitekey.server.exceptions.ForeignStateException;
import com.codeheadsystems.suitekey.server.exceptions.InvalidStateException;
import com.codeheadsystems.suitekey.server.exceptions.StateTokenException;
import com.codeheadsystems.suitekey.server.exceptions.TokenEndpointException;
import com.codeheadsystems.suitekey.server.provider.ClientCredentials;
import com.codeheadsystems.suitekey.server.provider.ProviderEndpoints;
import com.codeheadsystems.suitekey.server.provider.TokenEndpoint;
import com.codeheadsystems.suitekey.server.scope.AuthorizationScope;
import com.codeheadsystems.suitekey.server.state.AuthorizationState;
import com.codeheadsystems.suitekey.server.state.StateTokenManager;
import com.codeheadsystems.suitekey.server.store.CredentialRecord;
import com.codeheadsystems.suitekey.server.store.CredentialStore;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the three-legged OAuth2 authorization-code flow.
 * <p>
 * Each attempt moves through {@code START -> REDIRECTED -> CALLBACK_RECEIVED} and ends in
 * either {@code EXCHANGED} (a credential is written for the session) or {@code FAILED}. A
 * failed attempt is never retried automatically; the user starts over from the consent page.
 * <p>
 * Framework adapters stay thin and only translate the exceptions thrown here into HTTP
 * responses.
 */
@Singleton
public class AuthorizationFlowManager {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationFlowManager.class);

  private final StateTokenManager stateTokenManager;
  private final CredentialStore credentialStore;
  private final TokenEndpoint tokenEndpoint;
  private final ClientCredentials clientCredentials;
  private final ProviderEndpoints endpoints;
  private final Clock clock;

  /**
   * Instantiates a new Authorization flow manager.
   *
   * @param stateTokenManager the state token manager
   * @param credentialStore   the credential store
   * @param tokenEndpoint     the token endpoint
   * @param clientCredentials the client credentials
   * @param endpoints         the provider endpoints
   * @param clock             the clock
   */
  public AuthorizationFlowManager(final StateTokenManager stateTokenManager,
                                  final CredentialStore credentialStore,
                                  final TokenEndpoint tokenEndpoint,
                                  final ClientCredentials clientCredentials,
                                  final ProviderEndpoints endpoints,
                                  final Clock clock) {
    log.info("AuthorizationFlowManager({})", clientCredentials);
    this.stateTokenManager = stateTokenManager;
    this.credentialStore = credentialStore;
    this.tokenEndpoint = tokenEndpoint;
    this.clientCredentials = clientCredentials;
    this.endpoints = endpoints;
    this.clock = clock;
  }

  // ── Begin ────────────────────────────────────────────────────────────────

  /**
   * Starts a flow and returns the consent URL to redirect the user to.
   * <p>
   * The URL asks for the required scopes together with everything the session was already
   * granted, so that re-consent never narrows the credential.
   *
   * @param session        the session
   * @param requiredScopes the scopes the caller needs
   * @param returnTarget   where to send the user after login, may be null
   * @return the consent URL
   * @throws IllegalStateException if too many flows are pending
   */
  public URI beginAuthorization(final Session session,
                                final Set<AuthorizationScope> requiredScopes,
                                final String returnTarget) {
    log.debug("beginAuthorization({}, {})", session.id(), AuthorizationScope.join(requiredScopes));
    Set<AuthorizationScope> merged = new HashSet<>(requiredScopes);
    credentialStore.get(session.id()).ifPresent(r -> merged.addAll(r.grantedScopes()));
    AuthorizationState state = stateTokenManager.issue(session, merged, returnTarget);

    Map<String, String> params = new LinkedHashMap<>();
    params.put("client_id", clientCredentials.clientId());
    params.put("redirect_uri", clientCredentials.redirectUri());
    params.put("scope", AuthorizationScope.join(merged));
    params.put("state", state.id());
    params.put("response_type", "code");
    params.put("access_type", "offline");
    params.put("include_granted_scopes", "true");
    params.put("prompt", "consent");
    return withQuery(endpoints.authorizationUri(), params);
  }

  // ── Complete ─────────────────────────────────────────────────────────────

  /**
   * Handles the provider's callback.
   *
   * @param callerSession     the session of the browser presenting the callback, may be null
   * @param stateParam        the {@code state} query parameter
   * @param authorizationCode the {@code code} query parameter
   * @return the authorization outcome
   * @throws InvalidStateException   if the state is unknown, expired, already used or was
   *                                 issued to another session
   * @throws ExchangeFailedException if the code is missing or the provider refused it
   */
  public AuthorizationOutcome completeAuthorization(final Session callerSession,
                                                    final String stateParam,
                                                    final String authorizationCode) {
    return completeAuthorization(callerSession, stateParam, authorizationCode, null);
  }

  /**
   * Handles the provider's callback, including an {@code error} parameter such as
   * {@code access_denied}. The state is consumed before anything else is checked, and must
   * belong to {@code callerSession}.
   *
   * @param callerSession     the session of the browser presenting the callback, may be null
   * @param stateParam        the {@code state} query parameter
   * @param authorizationCode the {@code code} query parameter, may be null
   * @param providerError     the {@code error} query parameter, may be null
   * @return the authorization outcome
   * @throws InvalidStateException   if the state is unknown, expired, already used or was
   *                                 issued to another session
   * @throws ExchangeFailedException if the provider reported an error, the code is missing or
   *                                 the exchange failed
   */
  public AuthorizationOutcome completeAuthorization(final Session callerSession,
                                                    final String stateParam,
                                                    final String authorizationCode,
                                                    final String providerError) {
    log.debug("completeAuthorization()");
    AuthorizationState state;
    try {
      state = stateTokenManager.consume(stateParam);
    } catch (StateTokenException e) {
      log.info("Rejected callback: {}", e.getMessage());
      throw new InvalidStateException(e);
    }
    // The code is only exchanged for the browser that started the flow.
    if (callerSession == null || !callerSession.id().equals(state.sessionId())) {
      log.warn("Rejected callback for session {}: presented by {}", state.sessionId(),
          callerSession == null ? "no session" : "session " + callerSession.id());
      throw new InvalidStateException(new ForeignStateException());
    }
    if (providerError != null && !providerError.isBlank()) {
      log.info("Provider reported '{}' for session {}", providerError, state.sessionId());
      throw new ExchangeFailedException("Provider reported error: " + providerError, null);
    }
    if (authorizationCode == null || authorizationCode.isBlank()) {
      throw new ExchangeFailedException("Callback carried no authorization code", null);
    }

    TokenResponse tokenResponse;
    try {
      tokenResponse = tokenEndpoint.exchangeCode(authorizationCode);
    } catch (TokenEndpointException e) {
      log.warn("Code exchange failed for session {}: {}", state.sessionId(), e.getMessage());
      throw new ExchangeFailedException("Authorization code exchange failed", e);
    }

    Optional<CredentialRecord> previous = credentialStore.get(state.sessionId());
    Set<AuthorizationScope> granted = new HashSet<>(AuthorizationScope.parse(tokenResponse.scope()));
    if (granted.isEmpty()) {
      granted.addAll(state.requestedScopes());
    }
    previous.ifPresent(r -> granted.addAll(r.grantedScopes()));
    String refreshToken = tokenResponse.hasRefreshToken()
        ? tokenResponse.refreshToken()
        : previous.map(CredentialRecord::refreshToken).orElse(null);

    CredentialRecord record = new CredentialRecord(
        state.sessionId(),
        tokenResponse.accessToken(),
        refreshToken,
        clock.instant().plusSeconds(tokenResponse.expiresIn()),
        granted);
    credentialStore.put(state.sessionId(), record);
    log.info("Stored credential for session {} with scopes {}", state.sessionId(),
        AuthorizationScope.join(granted));
    return new AuthorizationOutcome(record, state.returnTarget());
  }

  // ── Sign out ─────────────────────────────────────────────────────────────

  /**
   * Forgets the session's credential and asks the provider to revoke it.
   * <p>
   * Revocation is best effort: a failure is logged and the local record is gone regardless.
   *
   * @param session the session
   */
  public void signOut(final Session session) {
    log.debug("signOut({})", session.id());
    Optional<CredentialRecord> record = credentialStore.get(session.id());
    credentialStore.delete(session.id());
    record.ifPresent(r -> {
      String token = r.refreshTokenOptional().orElse(r.accessToken());
      try {
        tokenEndpoint.revoke(token);
      } catch (TokenEndpointException e) {
        log.warn("Token revocation failed for session {}: {}", session.id(), e.getMessage());
      }
    });
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private static URI withQuery(URI base, Map<String, String> params) {
    String query = params.entrySet().stream()
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
    String separator = base.getRawQuery() == null ? "?" : "&";
    return URI.create(base + separator + query);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
