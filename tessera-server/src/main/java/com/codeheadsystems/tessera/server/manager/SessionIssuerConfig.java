package com.codeheadsystems.tessera.server.manager;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for session issuance.
 *
 * @param accessTokenTtl      lifetime of every minted access token, whole seconds and at least one
 * @param secretBits          strength of each session secret, at least {@value #MIN_SECRET_BITS}
 * @param lookupFailurePolicy reaction to a failed permission lookup
 */
public record SessionIssuerConfig(
    Duration accessTokenTtl,
    int secretBits,
    PermissionLookupFailurePolicy lookupFailurePolicy) {

  /**
   * Lower bound on session secret strength.
   */
  public static final int MIN_SECRET_BITS = 128;

  public SessionIssuerConfig {
    Objects.requireNonNull(accessTokenTtl, "accessTokenTtl");
    Objects.requireNonNull(lookupFailurePolicy, "lookupFailurePolicy");
    if (accessTokenTtl.compareTo(Duration.ofSeconds(1)) < 0 || accessTokenTtl.getNano() != 0) {
      throw new IllegalArgumentException("accessTokenTtl must be a whole number of seconds, at least 1, got "
          + accessTokenTtl);
    }
    if (secretBits < MIN_SECRET_BITS) {
      throw new IllegalArgumentException(
          "secretBits must be at least " + MIN_SECRET_BITS + ", got " + secretBits);
    }
  }

  /**
   * Fifteen-minute access tokens, 256-bit secrets, lookup failures grant nothing.
   *
   * @return the defaults
   */
  public static SessionIssuerConfig defaults() {
    return new SessionIssuerConfig(Duration.ofMinutes(15), 256, PermissionLookupFailurePolicy.GRANT_NONE);
  }
}
