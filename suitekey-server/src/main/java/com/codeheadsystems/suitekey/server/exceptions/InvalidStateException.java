package com.codeheadsystems.suitekey.server.exceptions;

/**
 * The callback's state parameter could not be accepted. The flow must restart from consent.
 * <p>
 * Callers never need to know why the state was refused; the cause is kept for logging only.
 */
public class InvalidStateException extends SecurityException {

  /**
   * Instantiates a new Invalid state exception.
   *
   * @param cause the state token failure
   */
  public InvalidStateException(final StateTokenException cause) {
    super("Invalid authorization state", cause);
  }
}
