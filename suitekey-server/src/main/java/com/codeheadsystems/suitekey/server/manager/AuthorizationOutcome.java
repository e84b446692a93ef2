package com.codeheadsystems.suitekey.server.manager;

import com.codeheadsystems.suitekey.server.store.CredentialRecord;
import java.util.Optional;

/**
 * Result of a successful callback.
 *
 * @param record       the credential now stored for the session
 * @param returnTarget where the user asked to go after login, may be null
 */
public record AuthorizationOutcome(CredentialRecord record, String returnTarget) {

  /**
   * Return target optional.
   *
   * @return the optional
   */
  public Optional<String> returnTargetOptional() {
    return Optional.ofNullable(returnTarget);
  }
}
