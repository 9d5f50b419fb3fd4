package com.codeheadsystems.tessera.server.token;

import com.codeheadsystems.tessera.server.exceptions.GenerationException;
import com.codeheadsystems.tessera.server.model.RawSecret;

/**
 * Source of cryptographically random opaque secrets.
 */
public interface TokenGenerator {

  /**
   * Generates a secret of at least {@code bits} bits; the byte length is {@code ceil(bits / 8)}.
   *
   * @param bits requested strength, positive
   * @return a fresh secret
   * @throws GenerationException if the entropy source fails
   */
  RawSecret generate(int bits);
}
