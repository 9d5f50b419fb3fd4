package com.codeheadsystems.tessera.server.token;

import com.codeheadsystems.tessera.server.exceptions.GenerationException;
import com.codeheadsystems.tessera.server.model.RawSecret;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * {@link TokenGenerator} backed by an injectable {@link SecureRandom}.
 */
public class SecureRandomTokenGenerator implements TokenGenerator {

  private final SecureRandom random;

  /**
   * Creates a generator with a default {@link SecureRandom}.
   */
  public SecureRandomTokenGenerator() {
    this(new SecureRandom());
  }

  /**
   * Creates a generator with the given {@link SecureRandom}.
   *
   * @param random the random source to use
   */
  public SecureRandomTokenGenerator(SecureRandom random) {
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public RawSecret generate(int bits) {
    if (bits <= 0) {
      throw new IllegalArgumentException("bits must be positive, got " + bits);
    }
    byte[] out = new byte[(bits + 7) / 8];
    try {
      random.nextBytes(out);
    } catch (RuntimeException e) {
      throw new GenerationException("Entropy source unavailable", e);
    }
    return new RawSecret(out);
  }
}
