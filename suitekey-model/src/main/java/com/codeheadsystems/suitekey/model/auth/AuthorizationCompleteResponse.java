package com.codeheadsystems.suitekey.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Body returned by {@code GET /auth/callback} once the authorization code has been exchanged.
 * <p>
 * Deliberately carries no token material; agents obtain access tokens per request through
 * {@code GET /auth/token}.
 *
 * @param grantedScopes   the scopes now granted to the session, sorted
 * @param expiresAtEpochSecond expiry of the current access token, in epoch seconds
 * @param returnTo        the post-login target requested when the flow began, or null
 */
public record AuthorizationCompleteResponse(
    @JsonProperty("grantedScopes") List<String> grantedScopes,
    @JsonProperty("expiresAt") long expiresAtEpochSecond,
    @JsonProperty("returnTo") String returnTo) {
}
