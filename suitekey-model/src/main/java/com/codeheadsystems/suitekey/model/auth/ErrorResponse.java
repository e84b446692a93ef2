package com.codeheadsystems.suitekey.model.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by the authorization endpoints.
 * <p>
 * When the failure can be fixed by consenting again, {@code redirectUrl} holds the consent URL
 * the client should navigate to.
 *
 * @param error       short machine-readable code, e.g. {@code authorization_required}
 * @param message     human-readable message; never contains token material
 * @param redirectUrl consent URL to follow, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("message") String message,
    @JsonProperty("redirectUrl") String redirectUrl) {

  /**
   * Error without a redirect.
   *
   * @param error   the error
   * @param message the message
   * @return the error response
   */
  public static ErrorResponse of(String error, String message) {
    return new ErrorResponse(error, message, null);
  }
}
