package com.codeheadsystems.suitekey.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dropwizard configuration for the SuiteKey credential core.
 * <p>
 * {@code clientId}, {@code clientSecret} and {@code redirectUri} are required; startup fails
 * when any of them is missing. Values may reference environment variables, e.g.
 * {@code clientSecret: ${GOOGLE_CLIENT_SECRET}}, which the bundle substitutes at load time.
 * <p>
 * Generate a session secret with: {@code openssl rand -hex 32}
 */
public class SuitekeyConfiguration extends Configuration {
  /**
   * OAuth client id issued by the Google Cloud console.
   */
  @NotEmpty
  private String clientId = "";

  /**
   * OAuth client secret. Supply it through an environment variable such as {@code ${GOOGLE_CLIENT_SECRET}}; there is no default.
   */
  @NotEmpty
  private String clientSecret = "";

  /**
   * Callback URL registered with the provider, e.g. {@code https://host/auth/callback}.
   */
  @NotEmpty
  private String redirectUri = "";

  /**
   * HMAC secret for the session cookie.
   * Leave empty for random generation (dev only, sessions become invalid on restart).
   */
  private String sessionSecret = "";

  /**
   * How long a consent redirect stays valid.
   */
  @Min(1)
  private long stateTtlSeconds = 600;

  /**
   * Timeout for each call to the token and revocation endpoints.
   */
  @Min(1)
  private long tokenEndpointTimeoutSeconds = 10;

  /**
   * Access tokens are refreshed this many seconds before they expire.
   */
  @Min(0)
  private long clockSkewSeconds = 60;

  /**
   * Lifetime of the session cookie.
   */
  @Min(1)
  private long sessionTtlSeconds = 86400;

  /**
   * Whether the session cookie carries the Secure attribute. Disable only for plain-HTTP development.
   */
  private boolean secureCookie = true;

  /**
   * Override for the consent endpoint. Empty means Google's.
   */
  private String authorizationUri = "";

  /**
   * Override for the token endpoint. Empty means Google's.
   */
  private String tokenUri = "";

  /**
   * Override for the revocation endpoint. Empty means Google's.
   */
  private String revocationUri = "";

  /**
   * Extra agents, or replacement scopes for built-in ones, keyed by agent name.
   */
  private Map<String, List<String>> agentScopes = new LinkedHashMap<>();

  /**
   * Refresh token of the delegated user. Empty disables {@code /auth/delegated-token}.
   */
  private String delegatedUserRefreshToken = "";

  /**
   * Client id that issued the delegated refresh token. Empty means {@link #getClientId()}.
   */
  private String delegatedUserClientId = "";

  /**
   * Gets client id.
   *
   * @return the client id
   */
  @JsonProperty
  public String getClientId() {
    return clientId;
  }

  /**
   * Sets client id.
   *
   * @param clientId the client id
   */
  @JsonProperty
  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  /**
   * Gets client secret.
   *
   * @return the client secret
   */
  @JsonProperty
  public String getClientSecret() {
    return clientSecret;
  }

  /**
   * Sets client secret.
   *
   * @param clientSecret the client secret
   */
  @JsonProperty
  public void setClientSecret(String clientSecret) {
    this.clientSecret = clientSecret;
  }

  /**
   * Gets redirect uri.
   *
   * @return the redirect uri
   */
  @JsonProperty
  public String getRedirectUri() {
    return redirectUri;
  }

  /**
   * Sets redirect uri.
   *
   * @param redirectUri the redirect uri
   */
  @JsonProperty
  public void setRedirectUri(String redirectUri) {
    this.redirectUri = redirectUri;
  }

  /**
   * Gets session secret.
   *
   * @return the session secret
   */
  @JsonProperty
  public String getSessionSecret() {
    return sessionSecret;
  }

  /**
   * Sets session secret.
   *
   * @param sessionSecret the session secret
   */
  @JsonProperty
  public void setSessionSecret(String sessionSecret) {
    this.sessionSecret = sessionSecret;
  }

  /**
   * Gets state ttl seconds.
   *
   * @return the state ttl seconds
   */
  @JsonProperty
  public long getStateTtlSeconds() {
    return stateTtlSeconds;
  }

  /**
   * Sets state ttl seconds.
   *
   * @param stateTtlSeconds the state ttl seconds
   */
  @JsonProperty
  public void setStateTtlSeconds(long stateTtlSeconds) {
    this.stateTtlSeconds = stateTtlSeconds;
  }

  /**
   * Gets token endpoint timeout seconds.
   *
   * @return the token endpoint timeout seconds
   */
  @JsonProperty
  public long getTokenEndpointTimeoutSeconds() {
    return tokenEndpointTimeoutSeconds;
  }

  /**
   * Sets token endpoint timeout seconds.
   *
   * @param tokenEndpointTimeoutSeconds the token endpoint timeout seconds
   */
  @JsonProperty
  public void setTokenEndpointTimeoutSeconds(long tokenEndpointTimeoutSeconds) {
    this.tokenEndpointTimeoutSeconds = tokenEndpointTimeoutSeconds;
  }

  /**
   * Gets clock skew seconds.
   *
   * @return the clock skew seconds
   */
  @JsonProperty
  public long getClockSkewSeconds() {
    return clockSkewSeconds;
  }

  /**
   * Sets clock skew seconds.
   *
   * @param clockSkewSeconds the clock skew seconds
   */
  @JsonProperty
  public void setClockSkewSeconds(long clockSkewSeconds) {
    this.clockSkewSeconds = clockSkewSeconds;
  }

  /**
   * Gets session ttl seconds.
   *
   * @return the session ttl seconds
   */
  @JsonProperty
  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  /**
   * Sets session ttl seconds.
   *
   * @param sessionTtlSeconds the session ttl seconds
   */
  @JsonProperty
  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  /**
   * Is secure cookie.
   *
   * @return the secure cookie
   */
  @JsonProperty
  public boolean isSecureCookie() {
    return secureCookie;
  }

  /**
   * Sets secure cookie.
   *
   * @param secureCookie the secure cookie
   */
  @JsonProperty
  public void setSecureCookie(boolean secureCookie) {
    this.secureCookie = secureCookie;
  }

  /**
   * Gets authorization uri.
   *
   * @return the authorization uri
   */
  @JsonProperty
  public String getAuthorizationUri() {
    return authorizationUri;
  }

  /**
   * Sets authorization uri.
   *
   * @param authorizationUri the authorization uri
   */
  @JsonProperty
  public void setAuthorizationUri(String authorizationUri) {
    this.authorizationUri = authorizationUri;
  }

  /**
   * Gets token uri.
   *
   * @return the token uri
   */
  @JsonProperty
  public String getTokenUri() {
    return tokenUri;
  }

  /**
   * Sets token uri.
   *
   * @param tokenUri the token uri
   */
  @JsonProperty
  public void setTokenUri(String tokenUri) {
    this.tokenUri = tokenUri;
  }

  /**
   * Gets revocation uri.
   *
   * @return the revocation uri
   */
  @JsonProperty
  public String getRevocationUri() {
    return revocationUri;
  }

  /**
   * Sets revocation uri.
   *
   * @param revocationUri the revocation uri
   */
  @JsonProperty
  public void setRevocationUri(String revocationUri) {
    this.revocationUri = revocationUri;
  }

  /**
   * Gets agent scopes.
   *
   * @return the agent scopes
   */
  @JsonProperty
  public Map<String, List<String>> getAgentScopes() {
    return agentScopes;
  }

  /**
   * Sets agent scopes.
   *
   * @param agentScopes the agent scopes
   */
  @JsonProperty
  public void setAgentScopes(Map<String, List<String>> agentScopes) {
    this.agentScopes = agentScopes;
  }

  /**
   * Gets delegated user refresh token.
   *
   * @return the delegated user refresh token
   */
  @JsonProperty
  public String getDelegatedUserRefreshToken() {
    return delegatedUserRefreshToken;
  }

  /**
   * Sets delegated user refresh token.
   *
   * @param delegatedUserRefreshToken the delegated user refresh token
   */
  @JsonProperty
  public void setDelegatedUserRefreshToken(String delegatedUserRefreshToken) {
    this.delegatedUserRefreshToken = delegatedUserRefreshToken;
  }

  /**
   * Gets delegated user client id.
   *
   * @return the delegated user client id
   */
  @JsonProperty
  public String getDelegatedUserClientId() {
    return delegatedUserClientId;
  }

  /**
   * Sets delegated user client id.
   *
   * @param delegatedUserClientId the delegated user client id
   */
  @JsonProperty
  public void setDelegatedUserClientId(String delegatedUserClientId) {
    this.delegatedUserClientId = delegatedUserClientId;
  }
}
