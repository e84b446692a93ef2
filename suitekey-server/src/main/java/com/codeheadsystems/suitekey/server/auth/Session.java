package com.codeheadsystems.suitekey.server.auth;

import java.util.Objects;

/**
 * The binding between one client and its credential record.
 *
 * @param id the session identifier
 */
public record Session(String id) {

  /**
   * Instantiates a new Session.
   *
   * @param id the id
   */
  public Session {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) {
      throw new IllegalArgumentException("Session id must not be blank");
    }
  }
}
