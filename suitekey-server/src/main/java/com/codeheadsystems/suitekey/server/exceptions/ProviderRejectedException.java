package com.codeheadsystems.suitekey.server.exceptions;

/**
 * The provider answered with a 4xx status: the grant itself was refused.
 * <p>
 * For a refresh this is terminal and the stored credential must be discarded.
 */
public class ProviderRejectedException extends TokenEndpointException {

  private final int statusCode;
  private final String error;

  /**
   * Instantiates a new Provider rejected exception.
   *
   * @param statusCode the http status returned by the provider
   * @param error      the OAuth2 error code from the response body, may be null
   */
  public ProviderRejectedException(final int statusCode, final String error) {
    super("Provider rejected the request with HTTP " + statusCode
        + (error == null ? "" : " (" + error + ")"), null);
    this.statusCode = statusCode;
    this.error = error;
  }

  /**
   * Status code int.
   *
   * @return the int
   */
  public int statusCode() {
    return statusCode;
  }

  /**
   * OAuth2 error code, e.g. {@code invalid_grant}.
   *
   * @return the string, may be null
   */
  public String error() {
    return error;
  }
}
