package com.codeheadsystems.suitekey.server.manager;

import com.codeheadsystems.suitekey.model.oauth.TokenResponse;
import com.codeheadsystems.suitekey.server.exceptions.RefreshFailedException;
import com.codeheadsystems.suitekey.server.exceptions.TokenEndpointException;
import com.codeheadsystems.suitekey.server.manager.Resolution.ResolvedCredential;
import com.codeheadsystems.suitekey.server.provider.TokenEndpoint;
import com.codeheadsystems.suitekey.server.scope.AuthorizationScope;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Access tokens for a single pre-configured Google account.
 * <p>
 * The account's refresh token comes from configuration. The current access token is cached
 * until it comes within the clock-skew margin of expiry. Callers racing on an expired token
 * wait for one refresh.
 */
@Singleton
public class DelegatedUserTokenManager {

  private static final Logger log = LoggerFactory.getLogger(DelegatedUserTokenManager.class);

  private final TokenEndpoint tokenEndpoint;
  private final Clock clock;
  private final Duration clockSkew;
  private final Object refreshLock = new Object();

  private volatile String refreshToken;
  private volatile ResolvedCredential cached;

  /**
   * Instantiates a new Delegated user token manager.
   *
   * @param refreshToken  the delegated user's refresh token, empty when not configured
   * @param tokenEndpoint token endpoint registered for the client that issued the refresh token
   * @param clock         the clock
   * @param clockSkew     the clock skew
   */
  public DelegatedUserTokenManager(final Optional<String> refreshToken,
                                   final TokenEndpoint tokenEndpoint,
                                   final Clock clock,
                                   final Duration clockSkew) {
    this.refreshToken = refreshToken.filter(s -> !s.isBlank()).orElse(null);
    this.tokenEndpoint = tokenEndpoint;
    this.clock = clock;
    this.clockSkew = clockSkew;
    log.info("DelegatedUserTokenManager(configured={})", isConfigured());
  }

  /**
   * Whether a delegated user is configured.
   *
   * @return the boolean
   */
  public boolean isConfigured() {
    return refreshToken != null;
  }

  /**
   * Current access token for the delegated user, refreshed when needed.
   *
   * @return the resolved credential
   * @throws IllegalStateException  if no delegated user is configured
   * @throws RefreshFailedException if the provider refused or could not be reached
   */
  public ResolvedCredential accessToken() {
    log.debug("accessToken()");
    if (!isConfigured()) {
      throw new IllegalStateException("No delegated user refresh token configured");
    }
    ResolvedCredential current = cached;
    if (isFresh(current)) {
      return current;
    }
    synchronized (refreshLock) {
      current = cached;
      if (isFresh(current)) {
        return current;
      }
      TokenResponse tokenResponse;
      try {
        tokenResponse = tokenEndpoint.refresh(refreshToken);
      } catch (TokenEndpointException e) {
        log.warn("Delegated user token refresh failed: {}", e.getMessage());
        throw new RefreshFailedException("Delegated user token refresh failed", e);
      }
      if (tokenResponse.hasRefreshToken()) {
        refreshToken = tokenResponse.refreshToken();
      }
      Instant expiresAt = clock.instant().plusSeconds(tokenResponse.expiresIn());
      cached = new ResolvedCredential(tokenResponse.accessToken(), expiresAt,
          AuthorizationScope.parse(tokenResponse.scope()));
      log.debug("Refreshed delegated user token, expires {}", expiresAt);
      return cached;
    }
  }

  private boolean isFresh(ResolvedCredential credential) {
    return credential != null && credential.expiresAt().isAfter(clock.instant().plus(clockSkew));
  }
}
