package com.codeheadsystems.suitekey.server.state;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage abstraction for pending {@link AuthorizationState} entries.
 * <p>
 * Implementations must be thread-safe. Multi-instance deployments back this with a shared
 * keyed store so that the callback can land on a different node than the login.
 * <p>
 * <strong>Single-use contract:</strong> {@link #markConsumed(String)} must flip the consumed
 * flag as one atomic check-and-set. When several callers race on the same identifier exactly
 * one of them may observe a non-empty result; a read followed by a separate write is not
 * acceptable.
 */
public interface StateStore {

  /**
   * Stores a newly issued state.
   *
   * @param state the state
   */
  void store(AuthorizationState state);

  /**
   * Loads a state by identifier regardless of its consumed flag.
   *
   * @param id the state identifier
   * @return the state, or empty if unknown or evicted
   */
  Optional<AuthorizationState> load(String id);

  /**
   * Atomically marks the state consumed.
   *
   * @param id the state identifier
   * @return the consumed state if this call performed the transition; empty if the state is
   *     unknown or was already consumed
   */
  Optional<AuthorizationState> markConsumed(String id);

  /**
   * Removes a state, if present.
   *
   * @param id the state identifier
   */
  void remove(String id);

  /**
   * Removes every state created strictly before {@code cutoff}, consumed or not.
   *
   * @param cutoff the cutoff
   * @return the number of states removed
   */
  int removeCreatedBefore(Instant cutoff);

  /**
   * Number of states currently held.
   *
   * @return the int
   */
  int size();
}
