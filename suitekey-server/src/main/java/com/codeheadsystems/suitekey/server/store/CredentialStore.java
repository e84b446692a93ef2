package com.codeheadsystems.suitekey.server.store;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage abstraction for per-session {@link CredentialRecord}s.
 * <p>
 * Implementations must be thread-safe. Operations on different sessions must not block each
 * other, and {@link #update(String, UnaryOperator)} must be atomic for a single session.
 */
public interface CredentialStore {

  /**
   * Stores or replaces the record for the given session.
   *
   * @param sessionId the session identifier
   * @param record    the record
   */
  void put(String sessionId, CredentialRecord record);

  /**
   * Retrieves the record for the given session.
   *
   * @param sessionId the session identifier
   * @return the stored record, or empty if the session has no credential
   */
  Optional<CredentialRecord> get(String sessionId);

  /**
   * Removes the record for the given session, if present.
   *
   * @param sessionId the session identifier
   */
  void delete(String sessionId);

  /**
   * Atomically applies {@code updater} to the stored record. Nothing happens when the session
   * has no record. The updater may return null to delete the record, or the unchanged record
   * to leave it alone.
   *
   * @param sessionId the session identifier
   * @param updater   the read-modify-write function
   * @return the record after the update, or empty if none remains
   */
  Optional<CredentialRecord> update(String sessionId, UnaryOperator<CredentialRecord> updater);
}
