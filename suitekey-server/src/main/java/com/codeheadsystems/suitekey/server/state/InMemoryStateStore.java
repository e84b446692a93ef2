package com.codeheadsystems.suitekey.server.state;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link StateStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Only usable when login and callback are served by the same process.
 */
public class InMemoryStateStore implements StateStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

  private final ConcurrentHashMap<String, AuthorizationState> store = new ConcurrentHashMap<>();

  @Override
  public void store(AuthorizationState state) {
    store.put(state.id(), state);
    log.debug("Stored authorization state for session {}", state.sessionId());
  }

  @Override
  public Optional<AuthorizationState> load(String id) {
    return Optional.ofNullable(store.get(id));
  }

  @Override
  public Optional<AuthorizationState> markConsumed(String id) {
    // computeIfPresent runs under the bin lock for this key, making check-and-set atomic.
    AtomicReference<AuthorizationState> winner = new AtomicReference<>();
    store.computeIfPresent(id, (key, current) -> {
      if (current.consumed()) {
        return current;
      }
      AuthorizationState consumed = current.markConsumed();
      winner.set(consumed);
      return consumed;
    });
    return Optional.ofNullable(winner.get());
  }

  @Override
  public void remove(String id) {
    store.remove(id);
  }

  @Override
  public int removeCreatedBefore(Instant cutoff) {
    int before = store.size();
    store.values().removeIf(state -> state.createdAt().isBefore(cutoff));
    int removed = Math.max(0, before - store.size());
    if (removed > 0) {
      log.debug("Evicted {} authorization state(s)", removed);
    }
    return removed;
  }

  @Override
  public int size() {
    return store.size();
  }
}
