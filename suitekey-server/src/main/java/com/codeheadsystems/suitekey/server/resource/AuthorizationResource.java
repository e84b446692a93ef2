package com.codeheadsystems.suitekey.server.resource;

import com.codeheadsystems.suitekey.model.auth.AccessTokenResponse;
import com.codeheadsystems.suitekey.model.auth.AuthorizationCompleteResponse;
import com.codeheadsystems.suitekey.model.auth.ErrorResponse;
import com.codeheadsystems.suitekey.server.auth.Session;
import com.codeheadsystems.suitekey.server.auth.SessionTokenManager;
import com.codeheadsystems.suitekey.server.auth.SessionTokenManager.SessionToken;
import com.codeheadsystems.suitekey.server.exceptions.ExchangeFailedException;
import com.codeheadsystems.suitekey.server.exceptions.InvalidStateException;
import com.codeheadsystems.suitekey.server.exceptions.RefreshFailedException;
import com.codeheadsystems.suitekey.server.exceptions.UnknownAgentException;
import com.codeheadsystems.suitekey.server.manager.AuthorizationFlowManager;
import com.codeheadsystems.suitekey.server.manager.AuthorizationOutcome;
import com.codeheadsystems.suitekey.server.manager.CredentialResolver;
import com.codeheadsystems.suitekey.server.manager.DelegatedUserTokenManager;
import com.codeheadsystems.suitekey.server.manager.Resolution;
import com.codeheadsystems.suitekey.server.manager.Resolution.NeedsAuthorization;
import com.codeheadsystems.suitekey.server.manager.Resolution.ResolvedCredential;
import com.codeheadsystems.suitekey.server.scope.AuthorizationScope;
import com.codeheadsystems.suitekey.server.scope.ScopeRegistry;
import com.codeheadsystems.suitekey.server.store.CredentialRecord;
import jakarta.ws.rs.CookieParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for signing users in with Google and handing access tokens to agents.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code GET  /auth/login}           redirect to the consent page for some agents</li>
 *   <li>{@code GET  /auth/callback}        the provider's redirect back after consent</li>
 *   <li>{@code GET  /auth/token}           an access token covering some agents</li>
 *   <li>{@code POST /auth/logout}          forget and revoke the session's credential</li>
 *   <li>{@code GET  /auth/delegated-token} an access token for the configured delegated user</li>
 * </ul>
 * <p>
 * The browser is identified by the {@value #SESSION_COOKIE} cookie. Responses never carry a
 * refresh token.
 */
@Singleton
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
public class AuthorizationResource {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationResource.class);

  /**
   * Name of the session cookie.
   */
  public static final String SESSION_COOKIE = "SUITEKEY_SESSION";

  private static final String SIGN_IN_AGAIN = "Please sign in again";

  private final SessionTokenManager sessionTokenManager;
  private final AuthorizationFlowManager authorizationFlowManager;
  private final CredentialResolver credentialResolver;
  private final DelegatedUserTokenManager delegatedUserTokenManager;
  private final ScopeRegistry scopeRegistry;
  private final boolean secureCookie;

  /**
   * Instantiates a new Authorization resource.
   *
   * @param sessionTokenManager       the session token manager
   * @param authorizationFlowManager  the authorization flow manager
   * @param credentialResolver        the credential resolver
   * @param delegatedUserTokenManager the delegated user token manager
   * @param scopeRegistry             the scope registry
   * @param secureCookie              whether the session cookie is marked Secure
   */
  public AuthorizationResource(final SessionTokenManager sessionTokenManager,
                               final AuthorizationFlowManager authorizationFlowManager,
                               final CredentialResolver credentialResolver,
                               final DelegatedUserTokenManager delegatedUserTokenManager,
                               final ScopeRegistry scopeRegistry,
                               final boolean secureCookie) {
    log.info("AuthorizationResource(secureCookie={})", secureCookie);
    this.sessionTokenManager = sessionTokenManager;
    this.authorizationFlowManager = authorizationFlowManager;
    this.credentialResolver = credentialResolver;
    this.delegatedUserTokenManager = delegatedUserTokenManager;
    this.scopeRegistry = scopeRegistry;
    this.secureCookie = secureCookie;
  }

  // ── Login ────────────────────────────────────────────────────────────────

  /**
   * Redirects to the consent page for the named agents.
   *
   * @param cookie   the session cookie, may be null
   * @param agents   comma-separated agent names
   * @param returnTo a path on this server to land on after login, may be null
   * @return 303 to the consent page
   */
  @GET
  @Path("/login")
  public Response login(@CookieParam(SESSION_COOKIE) String cookie,
                        @QueryParam("agents") String agents,
                        @QueryParam("returnTo") String returnTo) {
    log.debug("login(agents={})", agents);
    Set<AuthorizationScope> scopes;
    try {
      scopes = scopeRegistry.mergedScopes(parseAgents(agents));
    } catch (UnknownAgentException e) {
      return badRequest(e.getMessage());
    } catch (IllegalArgumentException e) {
      return badRequest("At least one agent is required");
    }
    if (returnTo != null && !isLocalPath(returnTo)) {
      return badRequest("returnTo must be a path on this server");
    }

    SessionBinding binding = bind(cookie);
    URI consentUrl;
    try {
      consentUrl = authorizationFlowManager.beginAuthorization(binding.session(), scopes, returnTo);
    } catch (IllegalStateException e) {
      log.warn("Cannot start authorization: {}", e.getMessage());
      return tooManyPendingSignIns();
    }
    return binding.apply(Response.seeOther(consentUrl)).build();
  }

  // ── Callback ─────────────────────────────────────────────────────────────

  /**
   * Completes the flow when the provider redirects back. The browser must present the session
   * cookie the flow was started with.
   *
   * @param cookie the session cookie, may be null
   * @param state  the state parameter
   * @param code   the authorization code, absent on error
   * @param error  the provider error, absent on success
   * @return 200 with the granted scopes, or 303 to the requested return path
   */
  @GET
  @Path("/callback")
  public Response callback(@CookieParam(SESSION_COOKIE) String cookie,
                           @QueryParam("state") String state,
                           @QueryParam("code") String code,
                           @QueryParam("error") String error) {
    log.debug("callback()");
    AuthorizationOutcome outcome;
    try {
      outcome = authorizationFlowManager.completeAuthorization(
          sessionTokenManager.verify(cookie).orElse(null), state, code, error);
    } catch (InvalidStateException | ExchangeFailedException e) {
      log.info("Callback failed: {}", e.getMessage());
      return unauthorized(ErrorResponse.of("invalid_authorization", SIGN_IN_AGAIN));
    }
    if (outcome.returnTargetOptional().isPresent()) {
      return Response.seeOther(URI.create(outcome.returnTarget())).build();
    }
    CredentialRecord record = outcome.record();
    return Response.ok(new AuthorizationCompleteResponse(
        AuthorizationScope.sortedValues(record.grantedScopes()),
        record.expiresAt().getEpochSecond(),
        null)).build();
  }

  // ── Token ────────────────────────────────────────────────────────────────

  /**
   * Returns an access token covering the named agents, or the URL to visit first.
   * <p>
   * A caller without a valid session cookie is pointed at {@code /auth/login}; no session or
   * state is created here for it. A caller with a session gets the consent URL directly.
   *
   * @param cookie the session cookie, may be null
   * @param agents comma-separated agent names
   * @return 200 with the token, 401 with a redirect URL, or 503 when too many sign-ins are
   *     pending
   */
  @GET
  @Path("/token")
  public Response token(@CookieParam(SESSION_COOKIE) String cookie,
                        @QueryParam("agents") String agents) {
    log.debug("token(agents={})", agents);
    List<String> agentNames;
    try {
      agentNames = parseAgents(agents);
      scopeRegistry.mergedScopes(agentNames);
    } catch (UnknownAgentException e) {
      return badRequest(e.getMessage());
    } catch (IllegalArgumentException e) {
      return badRequest("At least one agent is required");
    }

    Optional<Session> session = sessionTokenManager.verify(cookie);
    if (session.isEmpty()) {
      // Login creates the session and the state together.
      return unauthorized(new ErrorResponse(
          Resolution.Reason.NO_CREDENTIAL.name().toLowerCase(Locale.ROOT),
          "Authorization required",
          loginPath(agentNames)));
    }
    Resolution resolution;
    try {
      resolution = credentialResolver.resolveAgents(session.get(), agentNames.toArray(new String[0]));
    } catch (IllegalStateException e) {
      log.warn("Cannot start authorization: {}", e.getMessage());
      return tooManyPendingSignIns();
    }
    if (resolution instanceof ResolvedCredential credential) {
      return Response.ok(toResponse(credential)).build();
    }
    NeedsAuthorization needs = (NeedsAuthorization) resolution;
    return unauthorized(new ErrorResponse(
        needs.reason().name().toLowerCase(Locale.ROOT),
        "Authorization required",
        needs.redirectUrl().toString()));
  }

  // ── Logout ───────────────────────────────────────────────────────────────

  /**
   * Forgets the session's credential and clears the cookie.
   *
   * @param cookie the session cookie, may be null
   * @return 204
   */
  @POST
  @Path("/logout")
  public Response logout(@CookieParam(SESSION_COOKIE) String cookie) {
    log.debug("logout()");
    sessionTokenManager.verify(cookie).ifPresent(authorizationFlowManager::signOut);
    return Response.noContent().cookie(sessionCookie("", 0)).build();
  }

  // ── Delegated user ───────────────────────────────────────────────────────

  /**
   * Returns an access token for the configured delegated user.
   *
   * @return 200 with the token, 404 when not configured, 502 when the provider fails
   */
  @GET
  @Path("/delegated-token")
  public Response delegatedToken() {
    log.debug("delegatedToken()");
    if (!delegatedUserTokenManager.isConfigured()) {
      return Response.status(Response.Status.NOT_FOUND)
          .entity(ErrorResponse.of("not_configured", "No delegated user is configured"))
          .build();
    }
    try {
      return Response.ok(toResponse(delegatedUserTokenManager.accessToken())).build();
    } catch (RefreshFailedException e) {
      return Response.status(Response.Status.BAD_GATEWAY)
          .entity(ErrorResponse.of("provider_error", "Could not obtain a token for the delegated user"))
          .build();
    }
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private SessionBinding bind(String cookie) {
    Optional<Session> existing = sessionTokenManager.verify(cookie);
    if (existing.isPresent()) {
      return new SessionBinding(existing.get(), null);
    }
    SessionToken issued = sessionTokenManager.issue();
    return new SessionBinding(issued.session(),
        sessionCookie(issued.token(), (int) Math.min(Integer.MAX_VALUE, sessionTokenManager.ttlSeconds())));
  }

  private NewCookie sessionCookie(String value, int maxAge) {
    return new NewCookie(SESSION_COOKIE, value, "/", null, Cookie.DEFAULT_VERSION, null,
        maxAge, null, secureCookie, true);
  }

  private static List<String> parseAgents(String agents) {
    if (agents == null || agents.isBlank()) {
      throw new IllegalArgumentException("No agents");
    }
    List<String> names = Arrays.stream(agents.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
    if (names.isEmpty()) {
      throw new IllegalArgumentException("No agents");
    }
    return names;
  }

  // Same-origin paths only; scheme-relative and backslash forms are rejected.
  private static boolean isLocalPath(String target) {
    return target.startsWith("/") && !target.startsWith("//") && !target.contains("\\");
  }

  private static AccessTokenResponse toResponse(ResolvedCredential credential) {
    return new AccessTokenResponse(credential.accessToken(),
        credential.expiresAt().getEpochSecond(),
        AuthorizationScope.sortedValues(credential.grantedScopes()));
  }

  private static Response badRequest(String message) {
    return Response.status(Response.Status.BAD_REQUEST)
        .entity(ErrorResponse.of("bad_request", message))
        .build();
  }

  private static Response tooManyPendingSignIns() {
    return Response.status(Response.Status.SERVICE_UNAVAILABLE)
        .entity(ErrorResponse.of("unavailable", "Too many pending sign-ins"))
        .build();
  }

  private static String loginPath(List<String> agentNames) {
    return "/auth/login?agents=" + URLEncoder.encode(String.join(",", agentNames), StandardCharsets.UTF_8);
  }

  private static Response unauthorized(ErrorResponse body) {
    return Response.status(Response.Status.UNAUTHORIZED).entity(body).build();
  }

  private record SessionBinding(Session session, NewCookie newCookie) {

    Response.ResponseBuilder apply(Response.ResponseBuilder builder) {
      return newCookie == null ? builder : builder.cookie(newCookie);
    }
  }
}
