package io.timezz.backend.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.timezz.backend.config.TimezzProperties;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues HS256 session tokens for Power-Up users. The subject is the Trello member id; the same
 * secret backs the resource server's {@code JwtDecoder}.
 */
@Service
public class SessionTokenService {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenService.class);
  static final int MIN_SECRET_BYTES = 32;

  private final byte[] secret;
  private final Duration ttl;
  private final String issuer;
  private final Clock clock;

  public SessionTokenService(TimezzProperties properties, Clock clock) {
    var security = properties.security();
    if (security.jwtSecret() == null
        || security.jwtSecret().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalStateException(
          "timezz.security.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    this.secret = security.jwtSecret().getBytes(StandardCharsets.UTF_8);
    this.ttl = security.tokenTtl() != null ? security.tokenTtl() : Duration.ofDays(30);
    this.issuer = security.issuer();
    this.clock = clock;
  }

  public record IssuedToken(String accessToken, Instant expiresAt) {}

  /**
   * @param subject Trello member id of the user
   * @return signed compact JWT and its expiry
   */
  public IssuedToken issue(String subject) {
    try {
      Instant now = clock.instant();
      Instant expiresAt = now.plus(ttl);
      var claims =
          new JWTClaimsSet.Builder()
              .jwtID(UUID.randomUUID().toString())
              .subject(subject)
              .issuer(issuer)
              .issueTime(Date.from(now))
              .expirationTime(Date.from(expiresAt))
              .build();

      var signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
      JWSSigner signer = new MACSigner(secret);
      signedJwt.sign(signer);

      log.debug("Issued session token for {} expiring at {}", subject, expiresAt);
      return new IssuedToken(signedJwt.serialize(), expiresAt);
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign session token", e);
    }
  }

  public SecretKey secretKey() {
    return new SecretKeySpec(secret, "HmacSHA256");
  }

  public String issuer() {
    return issuer;
  }
}
