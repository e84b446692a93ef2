package com.codeheadsystems.suitekey.server.state;

import com.codeheadsystems.suitekey.server.scope.AuthorizationScope;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * One in-flight authorization attempt, correlated with its callback through {@link #id()}.
 *
 * @param id              random identifier sent to the provider as the {@code state} parameter
 * @param sessionId       the session that started the flow
 * @param requestedScopes the (merged) scopes asked for in the consent URL
 * @param createdAt       when the state was issued
 * @param returnTarget    where to send the user after login, or null
 * @param consumed        whether a callback has already presented this state
 */
public record AuthorizationState(
    String id,
    String sessionId,
    Set<AuthorizationScope> requestedScopes,
    Instant createdAt,
    String returnTarget,
    boolean consumed) {

  /**
   * Instantiates a new Authorization state.
   */
  public AuthorizationState {
    requestedScopes = Set.copyOf(requestedScopes);
  }

  /**
   * Copy of this state with the consumed flag set.
   *
   * @return the authorization state
   */
  public AuthorizationState markConsumed() {
    return new AuthorizationState(id, sessionId, requestedScopes, createdAt, returnTarget, true);
  }

  /**
   * Whether the state is past its time window at {@code now}.
   *
   * @param now the now
   * @param ttl the ttl
   * @return the boolean
   */
  public boolean isExpired(Instant now, Duration ttl) {
    return !createdAt.plus(ttl).isAfter(now);
  }

  /**
   * Return target optional.
   *
   * @return the optional
   */
  public Optional<String> returnTargetOptional() {
    return Optional.ofNullable(returnTarget);
  }
}
