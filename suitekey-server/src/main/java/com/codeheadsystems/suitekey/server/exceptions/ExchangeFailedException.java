package com.codeheadsystems.suitekey.server.exceptions;

/**
 * The authorization code could not be exchanged for tokens. Codes are single-use, so the
 * caller must restart the flow rather than retry.
 */
public class ExchangeFailedException extends RuntimeException {

  /**
   * Instantiates a new Exchange failed exception.
   *
   * @param message the message
   * @param cause   the cause, may be null
   */
  public ExchangeFailedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
