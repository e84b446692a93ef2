package com.codeheadsystems.suitekey.server.manager;

import com.codeheadsystems.suitekey.model.oauth.TokenResponse;
import com.codeheadsystems.suitekey.server.auth.Session;
import com.codeheadsystems.suitekey.server.exceptions.ProviderRejectedException;
import com.codeheadsystems.suitekey.server.exceptions.ProviderUnavailableException;
import com.codeheadsystems.suitekey.server.manager.Resolution.NeedsAuthorization;
import com.codeheadsystems.suitekey.server.manager.Resolution.Reason;
import com.codeheadsystems.suitekey.server.manager.Resolution.ResolvedCredential;
import com.codeheadsystems.suitekey.server.provider.TokenEndpoint;
import com.codeheadsystems.suitekey.server.scope.AuthorizationScope;
import com.codeheadsystems.suitekey.server.scope.ScopeRegistry;
import com.codeheadsystems.suitekey.server.store.CredentialRecord;
import com.codeheadsystems.suitekey.server.store.CredentialStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-request entry point for agents that need a Google access token.
 * <p>
 * Looks up the session's credential, checks its scopes, refreshes it when it is about to
 * expire, and otherwise hands back a consent URL. Concurrent requests for the same session that
 * all need a refresh share one call to the token endpoint; no lock is held while that call is
 * in flight.
 */
@Singleton
public class CredentialResolver {

  private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

  private final CredentialStore credentialStore;
  private final AuthorizationFlowManager authorizationFlowManager;
  private final TokenEndpoint tokenEndpoint;
  private final ScopeRegistry scopeRegistry;
  private final Clock clock;
  private final Duration clockSkew;

  private final ConcurrentHashMap<String, CompletableFuture<RefreshOutcome>> refreshesInFlight =
      new ConcurrentHashMap<>();

  /**
   * Instantiates a new Credential resolver.
   *
   * @param credentialStore          the credential store
   * @param authorizationFlowManager the authorization flow manager
   * @param tokenEndpoint            the token endpoint
   * @param scopeRegistry            the scope registry
   * @param clock                    the clock
   * @param clockSkew                refresh this long before the recorded expiry
   */
  public CredentialResolver(final CredentialStore credentialStore,
                            final AuthorizationFlowManager authorizationFlowManager,
                            final TokenEndpoint tokenEndpoint,
                            final ScopeRegistry scopeRegistry,
                            final Clock clock,
                            final Duration clockSkew) {
    log.info("CredentialResolver(clockSkew={})", clockSkew);
    this.credentialStore = credentialStore;
    this.authorizationFlowManager = authorizationFlowManager;
    this.tokenEndpoint = tokenEndpoint;
    this.scopeRegistry = scopeRegistry;
    this.clock = clock;
    this.clockSkew = clockSkew;
  }

  /**
   * Resolves credentials covering the scopes of the named agents.
   *
   * @param session    the session
   * @param agentNames the agent names
   * @return the resolution
   * @throws com.codeheadsystems.suitekey.server.exceptions.UnknownAgentException if an agent is not registered
   * @throws IllegalStateException if a consent URL is needed and too many flows are pending
   */
  public Resolution resolveAgents(final Session session, final String... agentNames) {
    return resolve(session, scopeRegistry.mergedScopes(Arrays.asList(agentNames)), null);
  }

  /**
   * Resolves credentials covering {@code requiredScopes}.
   *
   * @param session        the session
   * @param requiredScopes the required scopes
   * @return the resolution
   * @throws IllegalStateException if a consent URL is needed and too many flows are pending
   */
  public Resolution resolve(final Session session, final Set<AuthorizationScope> requiredScopes) {
    return resolve(session, requiredScopes, null);
  }

  /**
   * Resolves credentials covering {@code requiredScopes}; a consent URL produced on the way
   * returns the user to {@code returnTarget}.
   * <p>
   * Every {@link NeedsAuthorization} result issues a fresh authorization state, so callers
   * exposed to anonymous traffic should only resolve for sessions they have already
   * established.
   *
   * @param session        the session
   * @param requiredScopes the required scopes
   * @param returnTarget   post-login destination, may be null
   * @return the resolution
   * @throws IllegalStateException if a consent URL is needed and too many flows are pending
   */
  public Resolution resolve(final Session session,
                            final Set<AuthorizationScope> requiredScopes,
                            final String returnTarget) {
    log.debug("resolve({}, {})", session.id(), AuthorizationScope.join(requiredScopes));
    Optional<CredentialRecord> stored = credentialStore.get(session.id());
    if (stored.isEmpty()) {
      return needsAuthorization(session, requiredScopes, returnTarget, Reason.NO_CREDENTIAL);
    }
    CredentialRecord record = stored.get();
    if (!record.covers(requiredScopes)) {
      return needsAuthorization(session, requiredScopes, returnTarget, Reason.INSUFFICIENT_SCOPE);
    }
    if (!record.expiresWithin(clock.instant(), clockSkew)) {
      return snapshot(record);
    }

    RefreshOutcome outcome = refreshSingleFlight(session.id());
    if (outcome.failure() != null) {
      return needsAuthorization(session, requiredScopes, returnTarget, outcome.failure());
    }
    CredentialRecord refreshed = outcome.record();
    if (!refreshed.covers(requiredScopes)) {
      return needsAuthorization(session, requiredScopes, returnTarget, Reason.INSUFFICIENT_SCOPE);
    }
    return snapshot(refreshed);
  }

  // ── Refresh ───────────────────────────────────────────────────────────────

  private RefreshOutcome refreshSingleFlight(String sessionId) {
    CompletableFuture<RefreshOutcome> mine = new CompletableFuture<>();
    CompletableFuture<RefreshOutcome> existing = refreshesInFlight.putIfAbsent(sessionId, mine);
    if (existing != null) {
      log.debug("Joining in-flight refresh for session {}", sessionId);
      try {
        return existing.join();
      } catch (CompletionException e) {
        if (e.getCause() instanceof RuntimeException cause) {
          throw cause;
        }
        throw e;
      }
    }
    try {
      RefreshOutcome outcome;
      // The record read by the caller may predate a refresh that finished in the meantime.
      Optional<CredentialRecord> latest = credentialStore.get(sessionId);
      if (latest.isEmpty()) {
        outcome = RefreshOutcome.failed(Reason.NO_CREDENTIAL);
      } else if (!latest.get().expiresWithin(clock.instant(), clockSkew)) {
        outcome = RefreshOutcome.refreshed(latest.get());
      } else {
        outcome = refresh(sessionId, latest.get());
      }
      mine.complete(outcome);
      return outcome;
    } catch (RuntimeException e) {
      mine.completeExceptionally(e);
      throw e;
    } finally {
      refreshesInFlight.remove(sessionId, mine);
    }
  }

  private RefreshOutcome refresh(String sessionId, CredentialRecord record) {
    String refreshToken = record.refreshToken();
    if (refreshToken == null || refreshToken.isBlank()) {
      log.info("Credential for session {} expired and has no refresh token", sessionId);
      deleteIfUnchanged(sessionId, record);
      return RefreshOutcome.failed(Reason.REFRESH_REJECTED);
    }

    TokenResponse tokenResponse;
    try {
      tokenResponse = tokenEndpoint.refresh(refreshToken);
    } catch (ProviderRejectedException e) {
      log.info("Refresh rejected for session {}: {}", sessionId, e.getMessage());
      deleteIfUnchanged(sessionId, record);
      return RefreshOutcome.failed(Reason.REFRESH_REJECTED);
    } catch (ProviderUnavailableException e) {
      log.warn("Refresh unavailable for session {}; keeping credential: {}", sessionId, e.getMessage());
      return RefreshOutcome.failed(Reason.PROVIDER_UNAVAILABLE);
    }

    Instant expiresAt = clock.instant().plusSeconds(tokenResponse.expiresIn());
    String rotated = tokenResponse.hasRefreshToken() ? tokenResponse.refreshToken() : null;
    // Only overwrite the record we refreshed; a concurrent re-login or logout wins.
    Optional<CredentialRecord> after = credentialStore.update(sessionId, current ->
        Objects.equals(current.refreshToken(), refreshToken)
            ? current.withRefreshedAccessToken(tokenResponse.accessToken(), expiresAt, rotated)
            : current);
    if (after.isEmpty()) {
      log.debug("Session {} signed out during refresh", sessionId);
      return RefreshOutcome.failed(Reason.NO_CREDENTIAL);
    }
    log.debug("Refreshed credential for session {}", sessionId);
    return RefreshOutcome.refreshed(after.get());
  }

  private void deleteIfUnchanged(String sessionId, CredentialRecord record) {
    credentialStore.update(sessionId, current ->
        Objects.equals(current.refreshToken(), record.refreshToken())
            && Objects.equals(current.accessToken(), record.accessToken())
            ? null
            : current);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private NeedsAuthorization needsAuthorization(Session session,
                                                Set<AuthorizationScope> requiredScopes,
                                                String returnTarget,
                                                Reason reason) {
    log.debug("Session {} needs authorization: {}", session.id(), reason);
    return new NeedsAuthorization(
        authorizationFlowManager.beginAuthorization(session, requiredScopes, returnTarget), reason);
  }

  private static ResolvedCredential snapshot(CredentialRecord record) {
    return new ResolvedCredential(record.accessToken(), record.expiresAt(), record.grantedScopes());
  }

  private record RefreshOutcome(CredentialRecord record, Reason failure) {

    static RefreshOutcome refreshed(CredentialRecord record) {
      return new RefreshOutcome(record, null);
    }

    static RefreshOutcome failed(Reason reason) {
      return new RefreshOutcome(null, reason);
    }
  }
}
