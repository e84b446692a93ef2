package com.codeheadsystems.suitekey.server.exceptions;

/**
 * The provider could not be reached, timed out, or answered with a 5xx status.
 * <p>
 * Says nothing about the validity of the grant, so stored credentials are kept.
 */
public class ProviderUnavailableException extends TokenEndpointException {

  /**
   * Instantiates a new Provider unavailable exception.
   *
   * @param message the message
   * @param cause   the cause, may be null
   */
  public ProviderUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
