package com.codeheadsystems.suitekey.server.exceptions;

/**
 * The presented state identifier was never issued, or has already been evicted.
 */
public class UnknownStateException extends StateTokenException {

  /**
   * Instantiates a new Unknown state exception.
   */
  public UnknownStateException() {
    super("Unknown authorization state");
  }
}
