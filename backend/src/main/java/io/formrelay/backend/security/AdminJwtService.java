package io.formrelay.backend.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.formrelay.backend.config.SecurityProperties;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Issues and verifies the HS256 session tokens used by the admin dashboard. */
@Service
public class AdminJwtService {

  private static final Logger log = LoggerFactory.getLogger(AdminJwtService.class);

  static final int MIN_SECRET_BYTES = 32;
  private static final String TOKEN_TYPE = "admin";

  private final byte[] secret;
  private final Duration tokenTtl;

  public AdminJwtService(SecurityProperties securityProperties) {
    if (securityProperties.jwtSecret() == null
        || securityProperties.jwtSecret().getBytes(StandardCharsets.UTF_8).length
            < MIN_SECRET_BYTES) {
      throw new IllegalStateException(
          "formrelay.security.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    this.secret = securityProperties.jwtSecret().getBytes(StandardCharsets.UTF_8);
    this.tokenTtl = securityProperties.tokenTtl();
  }

  /** Claims extracted from a verified admin token. */
  public record AdminClaims(UUID adminId, String email) {}

  public record IssuedToken(String token, Instant expiresAt) {}

  public IssuedToken issueToken(UUID adminId, String email) {
    try {
      Instant now = Instant.now();
      Instant expiresAt = now.plus(tokenTtl);
      var claims =
          new JWTClaimsSet.Builder()
              .jwtID(UUID.randomUUID().toString())
              .subject(adminId.toString())
              .claim("email", email)
              .claim("type", TOKEN_TYPE)
              .issueTime(Date.from(now))
              .expirationTime(Date.from(expiresAt))
              .build();

      var signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
      JWSSigner signer = new MACSigner(secret);
      signedJwt.sign(signer);

      log.debug("Issued admin token for {}", adminId);
      return new IssuedToken(signedJwt.serialize(), expiresAt);
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign admin token", e);
    }
  }

  /**
   * Verifies signature, expiry and token type.
   *
   * @throws AdminAuthException if the token is invalid or expired
   */
  public AdminClaims verifyToken(String token) {
    try {
      var signedJwt = SignedJWT.parse(token);
      JWSVerifier verifier = new MACVerifier(secret);

      if (!JWSAlgorithm.HS256.equals(signedJwt.getHeader().getAlgorithm())
          || !signedJwt.verify(verifier)) {
        throw new AdminAuthException("Invalid token signature");
      }

      var claims = signedJwt.getJWTClaimsSet();
      if (claims.getExpirationTime() == null
          || claims.getExpirationTime().toInstant().isBefore(Instant.now())) {
        throw new AdminAuthException("Session has expired");
      }
      if (!TOKEN_TYPE.equals(claims.getStringClaim("type"))) {
        throw new AdminAuthException("Invalid token type");
      }

      return new AdminClaims(UUID.fromString(claims.getSubject()), claims.getStringClaim("email"));
    } catch (ParseException | JOSEException | IllegalArgumentException e) {
      throw new AdminAuthException("Invalid token: " + e.getMessage());
    }
  }
}
