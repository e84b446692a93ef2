package com.codeheadsystems.suitekey.server.exceptions;

/**
 * Base type for the reasons a state token can be refused, either by
 * {@code StateTokenManager#consume(String)} or by the session check that follows it.
 * <p>
 * The authorization flow collapses every subtype into {@link InvalidStateException}; the
 * distinction only exists for logging and tests.
 */
public abstract class StateTokenException extends SecurityException {

  /**
   * Instantiates a new State token exception.
   *
   * @param message the message
   */
  protected StateTokenException(final String message) {
    super(message);
  }
}
