package com.codeheadsystems.suitekey.server.exceptions;

/**
 * A refresh token could not be turned into a new access token.
 */
public class RefreshFailedException extends RuntimeException {

  /**
   * Instantiates a new Refresh failed exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public RefreshFailedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
