package com.codeheadsystems.tessera.server.hash;

import com.codeheadsystems.tessera.server.exceptions.HashException;
import com.codeheadsystems.tessera.server.model.HashedSecret;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production {@link SecretHasher} using Argon2id with a fresh random salt per call.
 * <p>
 * Hashes are encoded in the PHC string format
 * {@code $argon2id$v=19$m=<kib>,t=<iterations>,p=<parallelism>$<salt>$<hash>}
 * (unpadded standard base64), so each hash carries the parameters it was made with and
 * {@link #needsRehash} can compare them against the current policy.
 */
public class Argon2idSecretHasher implements SecretHasher {

  private static final Logger log = LoggerFactory.getLogger(Argon2idSecretHasher.class);

  private static final String PREFIX = "$argon2id$v=19$";
  private static final int SALT_LENGTH = 16;
  private static final int HASH_LENGTH = 32;
  private static final Base64.Encoder B64 = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final int memoryKib;
  private final int iterations;
  private final int parallelism;
  private final SecureRandom random;

  /**
   * Instantiates a new Argon2id secret hasher.
   *
   * @param memoryKib   memory cost in kibibytes
   * @param iterations  iteration count
   * @param parallelism lanes
   * @param random      salt source
   */
  public Argon2idSecretHasher(int memoryKib, int iterations, int parallelism, SecureRandom random) {
    if (memoryKib < 8 * parallelism) {
      throw new IllegalArgumentException("argon2 memory must be at least 8 KiB per lane");
    }
    if (iterations < 1 || parallelism < 1) {
      throw new IllegalArgumentException("argon2 iterations and parallelism must be positive");
    }
    this.memoryKib = memoryKib;
    this.iterations = iterations;
    this.parallelism = parallelism;
    this.random = random;
    log.info("Argon2idSecretHasher(m={}, t={}, p={})", memoryKib, iterations, parallelism);
  }

  @Override
  public HashedSecret hash(String plain) {
    byte[] salt = new byte[SALT_LENGTH];
    random.nextBytes(salt);
    try {
      byte[] hash = derive(plain, new Params(memoryKib, iterations, parallelism), salt, HASH_LENGTH);
      return new HashedSecret(PREFIX
          + "m=" + memoryKib + ",t=" + iterations + ",p=" + parallelism
          + "$" + B64.encodeToString(salt)
          + "$" + B64.encodeToString(hash));
    } catch (RuntimeException e) {
      throw new HashException("Argon2id hashing failed", e);
    }
  }

  @Override
  public boolean verify(String plain, HashedSecret hashed) {
    if (plain == null || hashed == null) {
      return false;
    }
    Optional<Parsed> parsed = parse(hashed.value());
    if (parsed.isEmpty()) {
      log.debug("verify(): stored hash is not an argon2id PHC string");
      return false;
    }
    Parsed p = parsed.get();
    try {
      byte[] candidate = derive(plain, p.params(), p.salt(), p.hash().length);
      return Arrays.constantTimeAreEqual(candidate, p.hash());
    } catch (RuntimeException e) {
      log.debug("verify(): argon2id derivation failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public boolean needsRehash(HashedSecret hashed) {
    return parse(hashed.value())
        .map(p -> p.params().memoryKib() < memoryKib
            || p.params().iterations() < iterations
            || p.params().parallelism() < parallelism)
        .orElse(false);
  }

  private static byte[] derive(String plain, Params params, byte[] salt, int length) {
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    gen.init(new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(params.memoryKib())
        .withIterations(params.iterations())
        .withParallelism(params.parallelism())
        .build());
    byte[] output = new byte[length];
    gen.generateBytes(plain.getBytes(StandardCharsets.UTF_8), output, 0, output.length);
    return output;
  }

  // $argon2id$v=19$m=65536,t=3,p=1$<salt>$<hash>
  private static Optional<Parsed> parse(String encoded) {
    if (encoded == null || !encoded.startsWith(PREFIX)) {
      return Optional.empty();
    }
    String[] parts = encoded.substring(PREFIX.length()).split("\\$", -1);
    if (parts.length != 3) {
      return Optional.empty();
    }
    try {
      int m = -1;
      int t = -1;
      int p = -1;
      for (String kv : parts[0].split(",")) {
        String[] pair = kv.split("=", 2);
        if (pair.length != 2) {
          return Optional.empty();
        }
        int value = Integer.parseInt(pair[1]);
        switch (pair[0]) {
          case "m" -> m = value;
          case "t" -> t = value;
          case "p" -> p = value;
          default -> {
            return Optional.empty();
          }
        }
      }
      byte[] salt = B64D.decode(parts[1]);
      byte[] hash = B64D.decode(parts[2]);
      if (m < 1 || t < 1 || p < 1 || salt.length == 0 || hash.length == 0) {
        return Optional.empty();
      }
      return Optional.of(new Parsed(new Params(m, t, p), salt, hash));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  private record Params(int memoryKib, int iterations, int parallelism) {
  }

  private record Parsed(Params params, byte[] salt, byte[] hash) {
  }
}
