package com.codeheadsystems.suitekey.server.exceptions;

/**
 * The presented state identifier has already been consumed by an earlier callback.
 */
public class ReplayedStateException extends StateTokenException {

  /**
   * Instantiates a new Replayed state exception.
   */
  public ReplayedStateException() {
    super("Authorization state already used");
  }
}
