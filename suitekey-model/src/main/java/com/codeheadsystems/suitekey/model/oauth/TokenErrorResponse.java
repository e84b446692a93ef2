package com.codeheadsystems.suitekey.model.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for an OAuth2 error body (RFC 6749 §5.2) returned by the token endpoint.
 * <p>
 * The only error code the core reacts to specifically is {@value #INVALID_GRANT}: it means the
 * authorization code or refresh token was rejected and the user must consent again.
 *
 * @param error            the error code, e.g. {@code invalid_grant}
 * @param errorDescription human-readable description supplied by the provider
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("error_description") String errorDescription) {

  /**
   * Error code for a rejected authorization code or refresh token.
   */
  public static final String INVALID_GRANT = "invalid_grant";

  /**
   * Is invalid grant boolean.
   *
   * @return the boolean
   */
  public boolean isInvalidGrant() {
    return INVALID_GRANT.equals(error);
  }
}
