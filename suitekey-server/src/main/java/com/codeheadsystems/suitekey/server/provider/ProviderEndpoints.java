package com.codeheadsystems.suitekey.server.provider;

import java.net.URI;
import java.util.Objects;

/**
 * The three OAuth2 endpoints of the identity provider.
 *
 * @param authorizationUri where the user is sent to consent
 * @param tokenUri         where codes and refresh tokens are exchanged
 * @param revocationUri    where tokens are revoked on sign-out
 */
public record ProviderEndpoints(URI authorizationUri, URI tokenUri, URI revocationUri) {

  /**
   * Google's production endpoints.
   */
  public static final ProviderEndpoints GOOGLE = new ProviderEndpoints(
      URI.create("https://accounts.google.com/o/oauth2/v2/auth"),
      URI.create("https://oauth2.googleapis.com/token"),
      URI.create("https://oauth2.googleapis.com/revoke"));

  /**
   * Instantiates a new Provider endpoints.
   */
  public ProviderEndpoints {
    Objects.requireNonNull(authorizationUri, "authorizationUri");
    Objects.requireNonNull(tokenUri, "tokenUri");
    Objects.requireNonNull(revocationUri, "revocationUri");
  }

  /**
   * Google endpoints with any non-null argument overriding the default.
   *
   * @param authorizationUri the authorization uri, may be null
   * @param tokenUri         the token uri, may be null
   * @param revocationUri    the revocation uri, may be null
   * @return the provider endpoints
   */
  public static ProviderEndpoints googleWith(String authorizationUri, String tokenUri, String revocationUri) {
    return new ProviderEndpoints(
        isBlank(authorizationUri) ? GOOGLE.authorizationUri() : URI.create(authorizationUri),
        isBlank(tokenUri) ? GOOGLE.tokenUri() : URI.create(tokenUri),
        isBlank(revocationUri) ? GOOGLE.revocationUri() : URI.create(revocationUri));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
