package com.codeheadsystems.tessera.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.JWTCreationException;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.tessera.server.exceptions.ExpiredTokenException;
import com.codeheadsystems.tessera.server.exceptions.InvalidSignatureException;
import com.codeheadsystems.tessera.server.exceptions.MalformedTokenException;
import com.codeheadsystems.tessera.server.exceptions.TesseraException;
import com.codeheadsystems.tessera.server.model.AccessTokenClaims;
import com.codeheadsystems.tessera.server.model.UserId;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SignedTokenCodec} producing HMAC-SHA256 signed JWTs.
 * <p>
 * The user id travels as the subject, permissions as the {@value #PERMISSIONS_CLAIM} array claim.
 * JWT timestamps have one-second resolution, so decoded instants are truncated to whole seconds.
 */
public class JwtSignedTokenCodec implements SignedTokenCodec {

  /**
   * Name of the claim carrying the permission set.
   */
  public static final String PERMISSIONS_CLAIM = "permissions";

  private static final Logger log = LoggerFactory.getLogger(JwtSignedTokenCodec.class);
  private static final int MIN_SECRET_BYTES = 32;

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;

  /**
   * Creates a new codec.
   *
   * @param secret HMAC-SHA256 signing secret, at least 32 bytes
   * @param issuer JWT issuer claim, required on decode
   * @param clock  clock used to judge expiry on decode
   */
  public JwtSignedTokenCodec(byte[] secret, String issuer, Clock clock) {
    if (secret == null || secret.length < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(issuer))
        .build(clock);
    this.issuer = issuer;
  }

  @Override
  public String encode(AccessTokenClaims claims) {
    try {
      String token = JWT.create()
          .withIssuer(issuer)
          .withJWTId(UUID.randomUUID().toString())
          .withSubject(claims.userId().value())
          .withArrayClaim(PERMISSIONS_CLAIM, claims.permissions().stream().sorted().toArray(String[]::new))
          .withIssuedAt(claims.issuedAt())
          .withExpiresAt(claims.expiresAt())
          .sign(algorithm);
      log.debug("Encoded access token for user={} expiresAt={}", claims.userId(), claims.expiresAt());
      return token;
    } catch (JWTCreationException e) {
      throw new TesseraException("Unable to sign access token", e);
    }
  }

  @Override
  public AccessTokenClaims decode(String token) {
    if (token == null || token.isBlank()) {
      throw new MalformedTokenException("Access token is empty");
    }
    DecodedJWT decoded;
    try {
      decoded = verifier.verify(token);
    } catch (TokenExpiredException e) {
      log.debug("Access token expired at {}", e.getExpiredOn());
      throw new ExpiredTokenException("Access token expired", e);
    } catch (SignatureVerificationException | AlgorithmMismatchException e) {
      log.debug("Access token signature rejected: {}", e.getMessage());
      throw new InvalidSignatureException("Access token signature is invalid", e);
    } catch (JWTDecodeException e) {
      throw new MalformedTokenException("Access token is not a JWT", e);
    } catch (JWTVerificationException e) {
      log.debug("Access token claims rejected: {}", e.getMessage());
      throw new MalformedTokenException("Access token claims are invalid", e);
    }
    return toClaims(decoded);
  }

  private static AccessTokenClaims toClaims(DecodedJWT decoded) {
    String subject = decoded.getSubject();
    Instant issuedAt = decoded.getIssuedAtAsInstant();
    Instant expiresAt = decoded.getExpiresAtAsInstant();
    Claim permissions = decoded.getClaim(PERMISSIONS_CLAIM);
    if (subject == null || subject.isBlank() || issuedAt == null || expiresAt == null
        || permissions.isMissing() || permissions.isNull()) {
      throw new MalformedTokenException("Access token is missing required claims");
    }
    List<String> granted;
    try {
      granted = permissions.asList(String.class);
    } catch (JWTDecodeException e) {
      throw new MalformedTokenException("Permissions claim is not a string array", e);
    }
    if (granted == null) {
      throw new MalformedTokenException("Permissions claim is not a string array");
    }
    try {
      return new AccessTokenClaims(new UserId(subject), Set.copyOf(granted), issuedAt, expiresAt);
    } catch (IllegalArgumentException e) {
      throw new MalformedTokenException("Access token claims are inconsistent", e);
    }
  }
}
