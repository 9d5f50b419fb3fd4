package com.codeheadsystems.tessera.server.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Claims carried by a signed access token.
 *
 * @param userId      the subject
 * @param permissions permissions granted at issuance (immutable copy)
 * @param issuedAt    issuance instant
 * @param expiresAt   expiry instant, strictly after {@code issuedAt}
 */
public record AccessTokenClaims(
    UserId userId,
    Set<String> permissions,
    Instant issuedAt,
    Instant expiresAt) {

  public AccessTokenClaims {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(issuedAt, "issuedAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
    permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    if (!expiresAt.isAfter(issuedAt)) {
      throw new IllegalArgumentException("expiresAt must be after issuedAt");
    }
  }
}
