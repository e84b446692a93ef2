package com.codeheadsystems.suitekey.model.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a successful response from the provider's token endpoint.
 * <p>
 * Returned by {@code POST https://oauth2.googleapis.com/token} both for the authorization-code
 * grant and for the refresh-token grant.  On refresh the provider usually omits
 * {@code refresh_token}; callers must then keep the refresh token they already hold.
 * <p>
 * {@link #toString()} redacts the token values so instances can be logged safely.
 *
 * @param accessToken  the access token used to call the Workspace APIs
 * @param expiresIn    remaining lifetime of the access token in seconds, null when the
 *                     provider omitted it
 * @param refreshToken the refresh token, present only when offline access was granted or the
 *                     provider rotated it
 * @param scope        space-delimited list of the scopes actually granted
 * @param tokenType    token type, always {@code Bearer} for Google
 * @param idToken      OpenID Connect ID token, present when the {@code openid} scope was granted
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("expires_in") Long expiresIn,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("scope") String scope,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("id_token") String idToken) {

  /**
   * Whether the provider returned a refresh token in this response.
   *
   * @return true if a non-blank refresh token is present
   */
  public boolean hasRefreshToken() {
    return refreshToken != null && !refreshToken.isBlank();
  }

  /**
   * Whether the response carries a positive {@code expires_in}.
   *
   * @return true if the lifetime can be used to compute an expiry
   */
  public boolean hasUsableExpiry() {
    return expiresIn != null && expiresIn > 0;
  }

  @Override
  public String toString() {
    return "TokenResponse[accessToken=" + (accessToken == null ? "null" : "REDACTED")
        + ", expiresIn=" + expiresIn
        + ", refreshToken=" + (refreshToken == null ? "null" : "REDACTED")
        + ", scope=" + scope
        + ", tokenType=" + tokenType + "]";
  }
}
