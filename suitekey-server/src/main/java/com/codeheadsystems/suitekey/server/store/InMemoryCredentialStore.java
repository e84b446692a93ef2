package com.codeheadsystems.suitekey.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All credentials are lost on restart and every user has to sign in again. Suitable for
 * development and single-instance deployments only.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final ConcurrentHashMap<String, CredentialRecord> store = new ConcurrentHashMap<>();

  /**
   * Instantiates a new In memory credential store.
   */
  public InMemoryCredentialStore() {
    log.warn("Using InMemoryCredentialStore; credentials will NOT survive restarts. "
        + "Replace with a persistent CredentialStore for production.");
  }

  @Override
  public void put(String sessionId, CredentialRecord record) {
    if (!sessionId.equals(record.sessionId())) {
      throw new IllegalArgumentException("Record belongs to a different session");
    }
    store.put(sessionId, record);
    log.debug("Stored credential for session {}", sessionId);
  }

  @Override
  public Optional<CredentialRecord> get(String sessionId) {
    return Optional.ofNullable(store.get(sessionId));
  }

  @Override
  public void delete(String sessionId) {
    if (store.remove(sessionId) != null) {
      log.debug("Deleted credential for session {}", sessionId);
    }
  }

  @Override
  public Optional<CredentialRecord> update(String sessionId, UnaryOperator<CredentialRecord> updater) {
    return Optional.ofNullable(store.computeIfPresent(sessionId, (key, current) -> updater.apply(current)));
  }
}
