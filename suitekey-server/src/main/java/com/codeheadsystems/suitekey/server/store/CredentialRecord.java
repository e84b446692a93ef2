package com.codeheadsystems.suitekey.server.store;

import com.codeheadsystems.suitekey.server.scope.AuthorizationScope;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Token material held for one session.
 *
 * @param sessionId     the owning session
 * @param accessToken   the bearer token presented to Google APIs
 * @param refreshToken  long-lived token used to mint new access tokens, may be null
 * @param expiresAt     absolute expiry of the access token
 * @param grantedScopes scopes the user has consented to, only ever grows
 */
public record CredentialRecord(
    String sessionId,
    String accessToken,
    String refreshToken,
    Instant expiresAt,
    Set<AuthorizationScope> grantedScopes) {

  /**
   * Instantiates a new Credential record.
   */
  public CredentialRecord {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(accessToken, "accessToken");
    Objects.requireNonNull(expiresAt, "expiresAt");
    grantedScopes = Set.copyOf(grantedScopes);
  }

  /**
   * Refresh token optional.
   *
   * @return the optional
   */
  public Optional<String> refreshTokenOptional() {
    return Optional.ofNullable(refreshToken);
  }

  /**
   * Whether the access token is expired or will be within {@code skew} of {@code now}.
   *
   * @param now  the now
   * @param skew the clock-skew margin
   * @return the boolean
   */
  public boolean expiresWithin(Instant now, Duration skew) {
    return !expiresAt.isAfter(now.plus(skew));
  }

  /**
   * Whether every scope in {@code required} has been granted.
   *
   * @param required the required scopes
   * @return the boolean
   */
  public boolean covers(Set<AuthorizationScope> required) {
    return grantedScopes.containsAll(required);
  }

  /**
   * Copy carrying a refreshed access token. The refresh token is replaced only when the
   * provider rotated it; granted scopes are kept.
   *
   * @param newAccessToken  the new access token
   * @param newExpiresAt    the new expiry
   * @param rotatedRefresh  the rotated refresh token, or null to keep the current one
   * @return the credential record
   */
  public CredentialRecord withRefreshedAccessToken(String newAccessToken,
                                                   Instant newExpiresAt,
                                                   String rotatedRefresh) {
    return new CredentialRecord(sessionId, newAccessToken,
        rotatedRefresh != null ? rotatedRefresh : refreshToken, newExpiresAt, grantedScopes);
  }

  @Override
  public String toString() {
    return "CredentialRecord[sessionId=" + sessionId
        + ", accessToken=<redacted>"
        + ", refreshToken=" + (refreshToken == null ? "<none>" : "<redacted>")
        + ", expiresAt=" + expiresAt
        + ", grantedScopes=" + AuthorizationScope.sortedValues(grantedScopes) + "]";
  }
}
