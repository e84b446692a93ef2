package com.codeheadsystems.suitekey.server.exceptions;

/**
 * A call to the provider's token or revocation endpoint did not succeed.
 */
public abstract class TokenEndpointException extends RuntimeException {

  /**
   * Instantiates a new Token endpoint exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  protected TokenEndpointException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
