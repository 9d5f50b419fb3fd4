package com.codeheadsystems.tessera.server.manager;

import com.codeheadsystems.tessera.server.auth.SignedTokenCodec;
import com.codeheadsystems.tessera.server.exceptions.PermissionLookupException;
import com.codeheadsystems.tessera.server.model.AccessToken;
import com.codeheadsystems.tessera.server.model.AccessTokenClaims;
import com.codeheadsystems.tessera.server.model.UserId;
import com.codeheadsystems.tessera.server.store.PermissionLookup;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a user's permissions and signs them into an access token.
 */
public class AccessTokenFactory {

  private static final Logger log = LoggerFactory.getLogger(AccessTokenFactory.class);

  private final PermissionLookup permissionLookup;
  private final SignedTokenCodec signedTokenCodec;
  private final Duration ttl;
  private final PermissionLookupFailurePolicy failurePolicy;

  public AccessTokenFactory(PermissionLookup permissionLookup,
                            SignedTokenCodec signedTokenCodec,
                            Duration ttl,
                            PermissionLookupFailurePolicy failurePolicy) {
    this.permissionLookup = permissionLookup;
    this.signedTokenCodec = signedTokenCodec;
    if (ttl.compareTo(Duration.ofSeconds(1)) < 0 || ttl.getNano() != 0) {
      throw new IllegalArgumentException("ttl must be a whole number of seconds, at least 1, got " + ttl);
    }
    this.ttl = ttl;
    this.failurePolicy = failurePolicy;
  }

  /**
   * Mints an access token for {@code userId} valid from {@code now} for the configured TTL.
   * <p>
   * Claim times are whole seconds, the resolution of the signed token, so the returned claims are
   * exactly what a later decode yields.
   *
   * @param userId the subject
   * @param now    issuance instant
   * @return the token and its claims
   * @throws PermissionLookupException if the lookup fails under {@link PermissionLookupFailurePolicy#FAIL}
   */
  public AccessToken mint(UserId userId, Instant now) {
    Instant issuedAt = now.truncatedTo(ChronoUnit.SECONDS);
    AccessTokenClaims claims =
        new AccessTokenClaims(userId, resolvePermissions(userId), issuedAt, issuedAt.plus(ttl));
    return new AccessToken(signedTokenCodec.encode(claims), claims);
  }

  private Set<String> resolvePermissions(UserId userId) {
    try {
      Set<String> permissions = permissionLookup.permissionsFor(userId);
      return permissions == null ? Set.of() : permissions;
    } catch (RuntimeException e) {
      if (failurePolicy == PermissionLookupFailurePolicy.FAIL) {
        throw e instanceof PermissionLookupException ple
            ? ple
            : new PermissionLookupException("Permission lookup failed for user " + userId, e);
      }
      log.warn("Permission lookup failed for user={}; issuing access token with no permissions", userId, e);
      return Set.of();
    }
  }
}
