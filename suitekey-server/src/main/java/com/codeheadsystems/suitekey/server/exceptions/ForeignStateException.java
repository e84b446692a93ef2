package com.codeheadsystems.suitekey.server.exceptions;

/**
 * The presented state was issued to a different browser session than the one completing the
 * callback, or the callback carried no session at all.
 */
public class ForeignStateException extends StateTokenException {

  /**
   * Instantiates a new Foreign state exception.
   */
  public ForeignStateException() {
    super("Authorization state belongs to another session");
  }
}
