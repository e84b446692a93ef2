package com.codeheadsystems.suitekey.server.manager;

import com.codeheadsystems.suitekey.server.scope.AuthorizationScope;
import java.net.URI;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of asking the {@link CredentialResolver} for credentials.
 * <p>
 * Either a usable access token, or the consent URL the user must visit first.
 */
public sealed interface Resolution permits Resolution.ResolvedCredential, Resolution.NeedsAuthorization {

  /**
   * Why a resolution could not produce a credential.
   */
  enum Reason {
    /**
     * The session has never signed in, or has signed out.
     */
    NO_CREDENTIAL,
    /**
     * The stored credential lacks some of the required scopes.
     */
    INSUFFICIENT_SCOPE,
    /**
     * The provider refused the refresh token, or none was stored. The credential was removed.
     */
    REFRESH_REJECTED,
    /**
     * The provider could not be reached during refresh. The credential was kept.
     */
    PROVIDER_UNAVAILABLE
  }

  /**
   * Short-lived snapshot of a usable access token.
   *
   * @param accessToken   the bearer token
   * @param expiresAt     when it stops working
   * @param grantedScopes everything the token is good for
   */
  record ResolvedCredential(String accessToken, Instant expiresAt, Set<AuthorizationScope> grantedScopes)
      implements Resolution {

    /**
     * Instantiates a new Resolved credential.
     */
    public ResolvedCredential {
      Objects.requireNonNull(accessToken, "accessToken");
      Objects.requireNonNull(expiresAt, "expiresAt");
      grantedScopes = Set.copyOf(grantedScopes);
    }

    @Override
    public String toString() {
      return "ResolvedCredential[accessToken=<redacted>, expiresAt=" + expiresAt
          + ", grantedScopes=" + AuthorizationScope.sortedValues(grantedScopes) + "]";
    }
  }

  /**
   * The user must (re-)consent before the request can proceed.
   *
   * @param redirectUrl the consent URL
   * @param reason      why
   */
  record NeedsAuthorization(URI redirectUrl, Reason reason) implements Resolution {

    /**
     * Instantiates a new Needs authorization.
     */
    public NeedsAuthorization {
      Objects.requireNonNull(redirectUrl, "redirectUrl");
      Objects.requireNonNull(reason, "reason");
    }
  }
}
