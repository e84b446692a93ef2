package com.codeheadsystems.suitekey.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies the session cookie value.
 * <p>
 * The cookie is an HMAC-SHA256 JWT whose JTI is the session id. The token carries no
 * credential material; it only proves that this server handed out the session id.
 */
public class SessionTokenManager {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenManager.class);

  /**
   * Issuer claim written into every session token.
   */
  public static final String ISSUER = "suitekey";

  private static final int GENERATED_SECRET_BYTES = 32;

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final long ttlSeconds;
  private final Clock clock;
  private final SecureRandom secureRandom = new SecureRandom();

  /**
   * Creates a new SessionTokenManager.
   *
   * @param secret     HMAC-SHA256 signing secret; blank generates a random one
   * @param ttlSeconds token time-to-live in seconds
   * @param clock      source of issue and verification time
   */
  public SessionTokenManager(String secret, long ttlSeconds, Clock clock) {
    byte[] key;
    if (secret == null || secret.isBlank()) {
      log.warn("No session secret configured; using a random one. Sessions will not survive restarts.");
      key = new byte[GENERATED_SECRET_BYTES];
      secureRandom.nextBytes(key);
    } else {
      key = secret.getBytes(StandardCharsets.UTF_8);
    }
    this.algorithm = Algorithm.HMAC256(key);
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(ISSUER)).build(clock);
    this.ttlSeconds = ttlSeconds;
    this.clock = clock;
  }

  /**
   * A newly created session and its signed cookie value.
   *
   * @param session the session
   * @param token   the signed token
   */
  public record SessionToken(Session session, String token) {

    @Override
    public String toString() {
      return "SessionToken[session=" + session + ", token=<redacted>]";
    }
  }

  /**
   * Creates a new session and signs a token for it.
   *
   * @return the session token
   */
  public SessionToken issue() {
    byte[] id = new byte[GENERATED_SECRET_BYTES];
    secureRandom.nextBytes(id);
    Session session = new Session(Base64.getUrlEncoder().withoutPadding().encodeToString(id));
    Instant now = clock.instant();
    String token = JWT.create()
        .withIssuer(ISSUER)
        .withJWTId(session.id())
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(ttlSeconds))
        .sign(algorithm);
    log.debug("Issued session token for session {}", session.id());
    return new SessionToken(session, token);
  }

  /**
   * Verifies a cookie value.
   *
   * @param token the token, may be null
   * @return the session if the token is genuine and unexpired
   */
  public Optional<Session> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      String jti = decoded.getId();
      if (jti == null || jti.isBlank()) {
        log.debug("Session token has no JTI");
        return Optional.empty();
      }
      return Optional.of(new Session(jti));
    } catch (JWTVerificationException e) {
      log.debug("Session token verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Ttl seconds.
   *
   * @return the long
   */
  public long ttlSeconds() {
    return ttlSeconds;
  }
}
