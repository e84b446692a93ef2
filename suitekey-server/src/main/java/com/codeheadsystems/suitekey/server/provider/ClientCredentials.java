package com.codeheadsystems.suitekey.server.provider;

import java.util.Objects;

/**
 * The OAuth client registration used when talking to the provider.
 *
 * @param clientId     the client id
 * @param clientSecret the client secret
 * @param redirectUri  the registered callback URL
 */
public record ClientCredentials(String clientId, String clientSecret, String redirectUri) {

  /**
   * Instantiates a new Client credentials.
   */
  public ClientCredentials {
    requireText(clientId, "clientId");
    requireText(clientSecret, "clientSecret");
    requireText(redirectUri, "redirectUri");
  }

  /**
   * Same secret and redirect, different client id.
   *
   * @param otherClientId the other client id
   * @return the client credentials
   */
  public ClientCredentials withClientId(String otherClientId) {
    return new ClientCredentials(otherClientId, clientSecret, redirectUri);
  }

  @Override
  public String toString() {
    return "ClientCredentials[clientId=" + clientId + ", clientSecret=<redacted>, redirectUri=" + redirectUri + "]";
  }

  private static void requireText(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }
}
