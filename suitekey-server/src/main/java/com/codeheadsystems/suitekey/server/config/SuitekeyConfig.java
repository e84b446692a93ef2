package com.codeheadsystems.suitekey.server.config;

import com.codeheadsystems.suitekey.server.provider.ClientCredentials;
import com.codeheadsystems.suitekey.server.provider.ProviderEndpoints;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Framework-agnostic settings for the credential core.
 * <p>
 * Framework adapters (the Dropwizard bundle) build one of these from their own configuration
 * objects. There are no hard-coded secret fallbacks: the client secret is mandatory and a blank
 * session secret only yields a random per-process one.
 *
 * @param client                    OAuth client registration
 * @param endpoints                 provider endpoints
 * @param sessionSecret             HMAC secret for the session cookie, may be blank
 * @param stateTtl                  lifetime of an authorization state
 * @param tokenEndpointTimeout      per-request timeout for token endpoint calls
 * @param clockSkew                 margin before expiry at which access tokens are refreshed
 * @param sessionTtl                lifetime of a session cookie
 * @param secureCookie              whether the session cookie carries the Secure attribute
 * @param agentScopes               extra or overriding agent scope entries, may be empty
 * @param delegatedUserRefreshToken refresh token for the delegated user, may be null
 * @param delegatedUserClientId     client id that issued the delegated refresh token, may be null
 */
public record SuitekeyConfig(
    ClientCredentials client,
    ProviderEndpoints endpoints,
    String sessionSecret,
    Duration stateTtl,
    Duration tokenEndpointTimeout,
    Duration clockSkew,
    Duration sessionTtl,
    boolean secureCookie,
    Map<String, List<String>> agentScopes,
    String delegatedUserRefreshToken,
    String delegatedUserClientId) {

  /**
   * Default clock-skew margin.
   */
  public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofSeconds(60);

  /**
   * Default session lifetime.
   */
  public static final Duration DEFAULT_SESSION_TTL = Duration.ofSeconds(86400);

  /**
   * Instantiates a new Suitekey config.
   */
  public SuitekeyConfig {
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(endpoints, "endpoints");
    Objects.requireNonNull(stateTtl, "stateTtl");
    Objects.requireNonNull(tokenEndpointTimeout, "tokenEndpointTimeout");
    Objects.requireNonNull(clockSkew, "clockSkew");
    Objects.requireNonNull(sessionTtl, "sessionTtl");
    agentScopes = agentScopes == null ? Map.of() : Map.copyOf(agentScopes);
  }

  /**
   * Config with default timings against Google's endpoints.
   *
   * @param client the client
   * @return the suitekey config
   */
  public static SuitekeyConfig withDefaults(ClientCredentials client) {
    return new SuitekeyConfig(client, ProviderEndpoints.GOOGLE, null,
        Duration.ofSeconds(600), Duration.ofSeconds(10), DEFAULT_CLOCK_SKEW, DEFAULT_SESSION_TTL,
        true, Map.of(), null, null);
  }

  /**
   * The delegated user's refresh token, when one is configured.
   *
   * @return the optional
   */
  public Optional<String> delegatedUserRefreshTokenOptional() {
    return Optional.ofNullable(delegatedUserRefreshToken).filter(s -> !s.isBlank());
  }

  /**
   * Client credentials for refreshing the delegated user's token.
   *
   * @return the client credentials
   */
  public ClientCredentials delegatedUserClient() {
    if (delegatedUserClientId == null || delegatedUserClientId.isBlank()) {
      return client;
    }
    return client.withClientId(delegatedUserClientId);
  }

  @Override
  public String toString() {
    return "SuitekeyConfig[client=" + client
        + ", endpoints=" + endpoints
        + ", sessionSecret=" + (sessionSecret == null || sessionSecret.isBlank() ? "<none>" : "<redacted>")
        + ", stateTtl=" + stateTtl
        + ", tokenEndpointTimeout=" + tokenEndpointTimeout
        + ", clockSkew=" + clockSkew
        + ", sessionTtl=" + sessionTtl
        + ", secureCookie=" + secureCookie
        + ", agents=" + agentScopes.keySet()
        + ", delegatedUser=" + delegatedUserRefreshTokenOptional().isPresent() + "]";
  }
}
