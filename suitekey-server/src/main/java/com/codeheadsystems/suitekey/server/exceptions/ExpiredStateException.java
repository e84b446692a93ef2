package com.codeheadsystems.suitekey.server.exceptions;

/**
 * The presented state identifier is older than the configured state TTL.
 */
public class ExpiredStateException extends StateTokenException {

  /**
   * Instantiates a new Expired state exception.
   */
  public ExpiredStateException() {
    super("Authorization state expired");
  }
}
