package com.codeheadsystems.suitekey.server.provider;

import com.codeheadsystems.suitekey.model.oauth.TokenErrorResponse;
import com.codeheadsystems.suitekey.model.oauth.TokenResponse;
import com.codeheadsystems.suitekey.server.exceptions.ProviderRejectedException;
import com.codeheadsystems.suitekey.server.exceptions.ProviderUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the provider's token and revocation endpoints.
 * <p>
 * Requests are form-encoded POSTs carrying the client credentials, each bounded by an explicit
 * timeout. A 4xx answer becomes {@link ProviderRejectedException}; 5xx answers, I/O errors,
 * timeouts and interruptions become {@link ProviderUnavailableException}. Codes, tokens and the
 * client secret never appear in log lines or exception messages.
 */
public class GoogleTokenEndpointAccessor implements TokenEndpoint {

  private static final Logger log = LoggerFactory.getLogger(GoogleTokenEndpointAccessor.class);

  /**
   * Default per-request timeout.
   */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ClientCredentials clientCredentials;
  private final ProviderEndpoints endpoints;
  private final Duration timeout;

  /**
   * Instantiates a new Google token endpoint accessor.
   *
   * @param httpClient        the http client
   * @param objectMapper      the object mapper
   * @param clientCredentials the client credentials
   * @param endpoints         the endpoints
   * @param timeout           the per-request timeout
   */
  public GoogleTokenEndpointAccessor(final HttpClient httpClient,
                                     final ObjectMapper objectMapper,
                                     final ClientCredentials clientCredentials,
                                     final ProviderEndpoints endpoints,
                                     final Duration timeout) {
    log.info("GoogleTokenEndpointAccessor({}, tokenUri={})", clientCredentials, endpoints.tokenUri());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.clientCredentials = clientCredentials;
    this.endpoints = endpoints;
    this.timeout = timeout;
  }

  @Override
  public TokenResponse exchangeCode(final String authorizationCode) {
    log.debug("exchangeCode()");
    Map<String, String> form = new LinkedHashMap<>();
    form.put("grant_type", "authorization_code");
    form.put("code", authorizationCode);
    form.put("redirect_uri", clientCredentials.redirectUri());
    form.put("client_id", clientCredentials.clientId());
    form.put("client_secret", clientCredentials.clientSecret());
    return readTokenResponse(post(endpoints.tokenUri(), form));
  }

  @Override
  public TokenResponse refresh(final String refreshToken) {
    log.debug("refresh()");
    Map<String, String> form = new LinkedHashMap<>();
    form.put("grant_type", "refresh_token");
    form.put("refresh_token", refreshToken);
    form.put("client_id", clientCredentials.clientId());
    form.put("client_secret", clientCredentials.clientSecret());
    return readTokenResponse(post(endpoints.tokenUri(), form));
  }

  @Override
  public void revoke(final String token) {
    log.debug("revoke()");
    post(endpoints.revocationUri(), Map.of("token", token));
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private HttpResponse<String> post(URI uri, Map<String, String> form) {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(uri)
        .timeout(timeout)
        .header("Content-Type", FORM_CONTENT_TYPE)
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(encode(form)))
        .build();
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      // HttpTimeoutException is an IOException.
      throw new ProviderUnavailableException("HTTP request to " + uri + " failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderUnavailableException("HTTP request to " + uri + " interrupted", e);
    }
    checkStatus(uri, response);
    return response;
  }

  private void checkStatus(URI uri, HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode >= 500) {
      log.warn("Provider returned HTTP {} from {}", statusCode, uri);
      throw new ProviderUnavailableException("Provider returned HTTP " + statusCode, null);
    }
    if (statusCode >= 400) {
      String error = parseError(response.body());
      log.info("Provider rejected request to {} with HTTP {} ({})", uri, statusCode, error);
      throw new ProviderRejectedException(statusCode, error);
    }
  }

  private String parseError(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(body, TokenErrorResponse.class).error();
    } catch (JsonProcessingException e) {
      log.debug("Provider error body is not JSON");
      return null;
    }
  }

  private TokenResponse readTokenResponse(HttpResponse<String> response) {
    TokenResponse tokenResponse;
    try {
      tokenResponse = objectMapper.readValue(response.body(), TokenResponse.class);
    } catch (JsonProcessingException e) {
      // The exception message may echo the body, which contains tokens.
      throw new ProviderUnavailableException("Provider returned an unreadable token response", null);
    }
    if (tokenResponse == null || tokenResponse.accessToken() == null || tokenResponse.accessToken().isBlank()) {
      throw new ProviderUnavailableException("Provider returned a token response without an access token", null);
    }
    if (!tokenResponse.hasUsableExpiry()) {
      throw new ProviderUnavailableException("Provider returned a token response without a usable expires_in", null);
    }
    log.debug("Received {}", tokenResponse);
    return tokenResponse;
  }

  private static String encode(Map<String, String> form) {
    return form.entrySet().stream()
        .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
            + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
  }
}
