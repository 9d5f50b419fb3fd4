package com.codeheadsystems.tessera.server.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable record proving a user holds an active authenticated context.
 * <p>
 * Only the hash of the session secret is kept. {@code lastUseAt} never moves backwards:
 * {@link #withLastUseAt(Instant)} keeps the later of the current and the supplied instant.
 *
 * @param id         session identity, immutable
 * @param userId     owning user, immutable
 * @param createdAt  creation instant, set once
 * @param lastUseAt  instant of the most recent successful verification
 * @param secretHash hash of the session's raw secret
 */
public record Session(
    SessionId id,
    UserId userId,
    Instant createdAt,
    Instant lastUseAt,
    HashedSecret secretHash) {

  public Session {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(lastUseAt, "lastUseAt");
    Objects.requireNonNull(secretHash, "secretHash");
    if (lastUseAt.isBefore(createdAt)) {
      throw new IllegalArgumentException("lastUseAt must not precede createdAt");
    }
  }

  /**
   * Creates a brand-new session whose last use is its creation instant.
   *
   * @param id         the new session id
   * @param userId     the owner
   * @param now        creation instant
   * @param secretHash hash of the freshly generated secret
   * @return the session
   */
  public static Session open(SessionId id, UserId userId, Instant now, HashedSecret secretHash) {
    return new Session(id, userId, now, now, secretHash);
  }

  /**
   * Returns a copy marked as used at {@code instant}, unless that would move the timestamp back.
   *
   * @param instant the use instant
   * @return the updated session
   */
  public Session withLastUseAt(Instant instant) {
    if (!instant.isAfter(lastUseAt)) {
      return this;
    }
    return new Session(id, userId, createdAt, instant, secretHash);
  }

  /**
   * Returns a copy carrying a replacement hash of the same secret.
   *
   * @param upgraded the new hash
   * @return the updated session
   */
  public Session withSecretHash(HashedSecret upgraded) {
    return new Session(id, userId, createdAt, lastUseAt, upgraded);
  }
}
