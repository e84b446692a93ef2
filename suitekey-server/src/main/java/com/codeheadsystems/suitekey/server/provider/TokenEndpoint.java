package com.codeheadsystems.suitekey.server.provider;

import com.codeheadsystems.suitekey.model.oauth.TokenResponse;
import com.codeheadsystems.suitekey.server.exceptions.ProviderRejectedException;
import com.codeheadsystems.suitekey.server.exceptions.ProviderUnavailableException;

/**
 * The provider's token and revocation endpoints.
 * <p>
 * Every call either returns or throws within the configured timeout. Implementations throw
 * {@link ProviderRejectedException} when the provider answered with a 4xx, and
 * {@link ProviderUnavailableException} for 5xx answers, network errors and timeouts.
 */
public interface TokenEndpoint {

  /**
   * Exchanges an authorization code for tokens.
   *
   * @param authorizationCode the code from the callback
   * @return the token response
   */
  TokenResponse exchangeCode(String authorizationCode);

  /**
   * Obtains a new access token from a refresh token.
   *
   * @param refreshToken the refresh token
   * @return the token response, usually without a refresh token
   */
  TokenResponse refresh(String refreshToken);

  /**
   * Revokes an access or refresh token.
   *
   * @param token the token
   */
  void revoke(String token);
}
