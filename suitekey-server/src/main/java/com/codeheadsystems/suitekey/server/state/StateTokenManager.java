package com.codeheadsystems.suitekey.server.state;

import com.codeheadsystems.suitekey.server.auth.Session;
import com.codeheadsystems.suitekey.server.exceptions.ExpiredStateException;
import com.codeheadsystems.suitekey.server.exceptions.ReplayedStateException;
import com.codeheadsystems.suitekey.server.exceptions.UnknownStateException;
import com.codeheadsystems.suitekey.server.scope.AuthorizationScope;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and validates single-use anti-forgery {@code state} values for the consent redirect.
 * <p>
 * A background daemon thread evicts states older than the TTL. Consumed states stay in the
 * store until evicted so that a second presentation is reported as a replay rather than as an
 * unknown state. Call {@link #shutdown()} on application shutdown to release the thread.
 */
public class StateTokenManager {

  private static final Logger log = LoggerFactory.getLogger(StateTokenManager.class);

  /**
   * Default lifetime of an issued state.
   */
  public static final Duration DEFAULT_TTL = Duration.ofSeconds(600);

  /**
   * Upper bound on states held at once.
   */
  public static final int MAX_PENDING_STATES = 10_000;

  private static final int STATE_BYTES = 32;

  private final StateStore stateStore;
  private final Clock clock;
  private final Duration ttl;
  private final SecureRandom secureRandom = new SecureRandom();

  private final ScheduledExecutorService stateReaper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "authorization-state-reaper");
        t.setDaemon(true);
        return t;
      });

  /**
   * Instantiates a new State token manager.
   *
   * @param stateStore the state store
   * @param clock      the clock
   * @param ttl        how long an issued state stays valid
   */
  public StateTokenManager(final StateStore stateStore, final Clock clock, final Duration ttl) {
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("State TTL must be positive");
    }
    this.stateStore = stateStore;
    this.clock = clock;
    this.ttl = ttl;
    long periodMillis = Math.max(1L, ttl.toMillis() / 4);
    stateReaper.scheduleAtFixedRate(this::evictExpired, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    log.info("StateTokenManager(ttl={})", ttl);
  }

  /**
   * Shuts down the state reaper thread.
   * <p>
   * In Dropwizard, register a {@code Managed} component that calls this.
   */
  public void shutdown() {
    stateReaper.shutdown();
  }

  /**
   * Issues a fresh state for one authorization attempt.
   *
   * @param session         the session starting the flow
   * @param requestedScopes the scopes being asked for
   * @param returnTarget    where to go after login, may be null
   * @return the authorization state
   * @throws IllegalStateException if too many states are pending
   */
  public AuthorizationState issue(final Session session,
                                  final Set<AuthorizationScope> requestedScopes,
                                  final String returnTarget) {
    log.debug("issue({})", session.id());
    if (stateStore.size() >= MAX_PENDING_STATES) {
      throw new IllegalStateException("Too many pending authorization states");
    }
    AuthorizationState state = new AuthorizationState(
        newIdentifier(), session.id(), requestedScopes, clock.instant(), returnTarget, false);
    stateStore.store(state);
    return state;
  }

  /**
   * Validates and consumes a state presented by the callback.
   *
   * @param identifier the {@code state} query parameter
   * @return the consumed state
   * @throws UnknownStateException  if the identifier was never issued or has been evicted
   * @throws ExpiredStateException  if the state is older than the TTL
   * @throws ReplayedStateException if the state was already consumed
   */
  public AuthorizationState consume(final String identifier) {
    log.debug("consume()");
    if (identifier == null || identifier.isBlank()) {
      throw new UnknownStateException();
    }
    AuthorizationState current = stateStore.load(identifier).orElseThrow(UnknownStateException::new);
    if (current.consumed()) {
      throw new ReplayedStateException();
    }
    if (current.isExpired(clock.instant(), ttl)) {
      stateStore.remove(identifier);
      throw new ExpiredStateException();
    }
    Optional<AuthorizationState> consumed = stateStore.markConsumed(identifier);
    if (consumed.isEmpty()) {
      // Lost the race to another callback, or the reaper got there first.
      if (stateStore.load(identifier).isPresent()) {
        throw new ReplayedStateException();
      }
      throw new UnknownStateException();
    }
    return consumed.get();
  }

  /**
   * Removes states older than the TTL. Runs on the reaper thread.
   *
   * @return the number removed
   */
  int evictExpired() {
    try {
      return stateStore.removeCreatedBefore(clock.instant().minus(ttl));
    } catch (RuntimeException e) {
      log.warn("State eviction failed", e);
      return 0;
    }
  }

  /**
   * Ttl duration.
   *
   * @return the duration
   */
  public Duration ttl() {
    return ttl;
  }

  private String newIdentifier() {
    byte[] bytes = new byte[STATE_BYTES];
    secureRandom.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }
}
