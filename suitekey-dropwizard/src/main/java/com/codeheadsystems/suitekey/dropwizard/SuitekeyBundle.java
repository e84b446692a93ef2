package com.codeheadsystems.suitekey.dropwizard;

import com.codeheadsystems.suitekey.dropwizard.health.AuthorizationHealthCheck;
import com.codeheadsystems.suitekey.server.auth.SessionTokenManager;
import com.codeheadsystems.suitekey.server.config.SuitekeyConfig;
import com.codeheadsystems.suitekey.server.manager.AuthorizationFlowManager;
import com.codeheadsystems.suitekey.server.manager.CredentialResolver;
import com.codeheadsystems.suitekey.server.manager.DelegatedUserTokenManager;
import com.codeheadsystems.suitekey.server.provider.ClientCredentials;
import com.codeheadsystems.suitekey.server.provider.GoogleTokenEndpointAccessor;
import com.codeheadsystems.suitekey.server.provider.ProviderEndpoints;
import com.codeheadsystems.suitekey.server.provider.TokenEndpoint;
import com.codeheadsystems.suitekey.server.resource.AuthorizationResource;
import com.codeheadsystems.suitekey.server.scope.ScopeRegistry;
import com.codeheadsystems.suitekey.server.state.InMemoryStateStore;
import com.codeheadsystems.suitekey.server.state.StateStore;
import com.codeheadsystems.suitekey.server.state.StateTokenManager;
import com.codeheadsystems.suitekey.server.store.CredentialStore;
import com.codeheadsystems.suitekey.server.store.InMemoryCredentialStore;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the SuiteKey credential core into an existing Dropwizard
 * application.
 * <p>
 * Registers the {@code /auth} JAX-RS resource, a health check and a managed component that
 * stops the state reaper on shutdown. Requires a {@link SuitekeyConfiguration} block in the
 * application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (single instance only):
 * <pre>{@code
 *   bootstrap.addBundle(new SuitekeyBundle<>());
 * }</pre>
 * <p>
 * Or supply shared stores so several instances can serve the same users:
 * <pre>{@code
 *   bootstrap.addBundle(new SuitekeyBundle<>(myCredentialStore, myStateStore, null));
 * }</pre>
 * After {@code run}, agent resources obtain tokens through {@link #getCredentialResolver()}.
 */
@Singleton
public class SuitekeyBundle<C extends SuitekeyConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(SuitekeyBundle.class);

  private final CredentialStore credentialStore;
  private final StateStore stateStore;
  private final TokenEndpoint tokenEndpointOverride;
  private final Clock clock;

  private CredentialResolver credentialResolver;
  private AuthorizationFlowManager authorizationFlowManager;

  /**
   * Creates a bundle backed by in-memory stores.
   * <p>
   * All credentials are lost on restart and the callback must reach the same process as the
   * login.
   */
  public SuitekeyBundle() {
    this(new InMemoryCredentialStore(), new InMemoryStateStore(), null);
    log.warn("""
        #################################################################
        # WARNING: Using in-memory credential and state stores.        #
        # Users must sign in again after every restart.                 #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param credentialStore the credential store
   * @param stateStore      the state store
   * @param tokenEndpoint   token endpoint to use instead of Google's, or null
   */
  @Inject
  public SuitekeyBundle(CredentialStore credentialStore, StateStore stateStore, TokenEndpoint tokenEndpoint) {
    this.credentialStore = credentialStore;
    this.stateStore = stateStore;
    this.tokenEndpointOverride = tokenEndpoint;
    this.clock = Clock.systemUTC();
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    bootstrap.setConfigurationSourceProvider(new SubstitutingSourceProvider(
        bootstrap.getConfigurationSourceProvider(), new EnvironmentVariableSubstitutor(false)));
  }

  @Override
  public void run(C configuration, Environment environment) {
    SuitekeyConfig config = buildConfig(configuration);
    log.info("run({})", config);

    ScopeRegistry scopeRegistry = ScopeRegistry.googleWorkspaceWith(config.agentScopes());
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(config.tokenEndpointTimeout())
        .build();
    TokenEndpoint tokenEndpoint = tokenEndpointOverride != null
        ? tokenEndpointOverride
        : new GoogleTokenEndpointAccessor(httpClient, environment.getObjectMapper(),
            config.client(), config.endpoints(), config.tokenEndpointTimeout());
    TokenEndpoint delegatedTokenEndpoint = tokenEndpointOverride != null
        ? tokenEndpointOverride
        : new GoogleTokenEndpointAccessor(httpClient, environment.getObjectMapper(),
            config.delegatedUserClient(), config.endpoints(), config.tokenEndpointTimeout());

    StateTokenManager stateTokenManager = new StateTokenManager(stateStore, clock, config.stateTtl());
    authorizationFlowManager = new AuthorizationFlowManager(stateTokenManager, credentialStore,
        tokenEndpoint, config.client(), config.endpoints(), clock);
    credentialResolver = new CredentialResolver(credentialStore, authorizationFlowManager,
        tokenEndpoint, scopeRegistry, clock, config.clockSkew());
    DelegatedUserTokenManager delegatedUserTokenManager = new DelegatedUserTokenManager(
        config.delegatedUserRefreshTokenOptional(), delegatedTokenEndpoint, clock, config.clockSkew());
    SessionTokenManager sessionTokenManager =
        new SessionTokenManager(config.sessionSecret(), config.sessionTtl().toSeconds(), clock);

    environment.jersey().register(new AuthorizationResource(sessionTokenManager, authorizationFlowManager,
        credentialResolver, delegatedUserTokenManager, scopeRegistry, config.secureCookie()));
    environment.healthChecks().register("suitekey-authorization",
        new AuthorizationHealthCheck(scopeRegistry, stateStore));
    environment.lifecycle().manage(new Managed() {
      @Override
      public void start() {
        // reaper starts with the manager
      }

      @Override
      public void stop() {
        stateTokenManager.shutdown();
      }
    });
  }

  /**
   * The resolver agents call to obtain access tokens. Available after {@code run}.
   *
   * @return the credential resolver
   */
  public CredentialResolver getCredentialResolver() {
    if (credentialResolver == null) {
      throw new IllegalStateException("SuitekeyBundle has not been run yet");
    }
    return credentialResolver;
  }

  /**
   * The flow manager. Available after {@code run}.
   *
   * @return the authorization flow manager
   */
  public AuthorizationFlowManager getAuthorizationFlowManager() {
    if (authorizationFlowManager == null) {
      throw new IllegalStateException("SuitekeyBundle has not been run yet");
    }
    return authorizationFlowManager;
  }

  private SuitekeyConfig buildConfig(C configuration) {
    ClientCredentials client = new ClientCredentials(
        configuration.getClientId(), configuration.getClientSecret(), configuration.getRedirectUri());
    ProviderEndpoints endpoints = ProviderEndpoints.googleWith(
        configuration.getAuthorizationUri(), configuration.getTokenUri(), configuration.getRevocationUri());
    return new SuitekeyConfig(
        client,
        endpoints,
        configuration.getSessionSecret(),
        Duration.ofSeconds(configuration.getStateTtlSeconds()),
        Duration.ofSeconds(configuration.getTokenEndpointTimeoutSeconds()),
        Duration.ofSeconds(configuration.getClockSkewSeconds()),
        Duration.ofSeconds(configuration.getSessionTtlSeconds()),
        configuration.isSecureCookie(),
        configuration.getAgentScopes(),
        configuration.getDelegatedUserRefreshToken(),
        configuration.getDelegatedUserClientId());
  }
}
