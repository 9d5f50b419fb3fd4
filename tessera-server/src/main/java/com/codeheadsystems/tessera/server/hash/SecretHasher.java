package com.codeheadsystems.tessera.server.hash;

import com.codeheadsystems.tessera.server.exceptions.HashException;
import com.codeheadsystems.tessera.server.model.HashedSecret;

/**
 * One-way hashing of session secrets.
 * <p>
 * Implementations must be thread-safe. Production implementations salt every call, so two hashes
 * of the same input differ while both verify; deterministic implementations exist for tests and
 * local development only.
 */
public interface SecretHasher {

  /**
   * Hashes a secret.
   *
   * @param plain the secret in string form
   * @return the encoded hash
   * @throws HashException only on catastrophic internal failure
   */
  HashedSecret hash(String plain);

  /**
   * Checks a candidate secret against a stored hash.
   * <p>
   * Never throws: a malformed or foreign hash simply does not verify.
   *
   * @param plain  the candidate secret
   * @param hashed the stored hash
   * @return true if {@code plain} is the secret {@code hashed} was derived from
   */
  boolean verify(String plain, HashedSecret hashed);

  /**
   * Whether a stored hash was produced with parameters weaker than this hasher's current policy
   * and should be replaced the next time the plain secret is available.
   *
   * @param hashed the stored hash
   * @return true if the hash should be upgraded
   */
  default boolean needsRehash(HashedSecret hashed) {
    return false;
  }
}
