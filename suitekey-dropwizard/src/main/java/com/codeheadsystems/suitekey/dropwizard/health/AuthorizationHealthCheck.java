package com.codeheadsystems.suitekey.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.suitekey.server.scope.ScopeRegistry;
import com.codeheadsystems.suitekey.server.state.StateStore;
import com.codeheadsystems.suitekey.server.state.StateTokenManager;

/**
 * Health check that reports the registered agents and flags a state store close to its cap.
 */
public class AuthorizationHealthCheck extends HealthCheck {

  private final ScopeRegistry scopeRegistry;
  private final StateStore stateStore;

  /**
   * Instantiates a new Authorization health check.
   *
   * @param scopeRegistry the scope registry
   * @param stateStore    the state store
   */
  public AuthorizationHealthCheck(ScopeRegistry scopeRegistry, StateStore stateStore) {
    this.scopeRegistry = scopeRegistry;
    this.stateStore = stateStore;
  }

  @Override
  protected Result check() {
    if (scopeRegistry.agentNames().isEmpty()) {
      return Result.unhealthy("No agents registered");
    }
    int pending = stateStore.size();
    if (pending >= StateTokenManager.MAX_PENDING_STATES) {
      return Result.unhealthy("Pending authorization states at cap (%d)", pending);
    }
    return Result.healthy("agents=%s pendingStates=%d", scopeRegistry.agentNames(), pending);
  }
}
