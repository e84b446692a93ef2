package com.codeheadsystems.suitekey.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Body returned by the token lookup endpoints.
 * <p>
 * The access token is a snapshot valid for the current request only; callers must ask again on
 * the next request because it may have been refreshed in between.
 *
 * @param accessToken          the bearer token for the Workspace APIs
 * @param expiresAtEpochSecond expiry of the token, in epoch seconds
 * @param scopes               the scopes the token carries, sorted
 */
public record AccessTokenResponse(
    @JsonProperty("accessToken") String accessToken,
    @JsonProperty("expiresAt") long expiresAtEpochSecond,
    @JsonProperty("scopes") List<String> scopes) {

  @Override
  public String toString() {
    return "AccessTokenResponse[accessToken=REDACTED, expiresAt=" + expiresAtEpochSecond
        + ", scopes=" + scopes + "]";
  }
}
