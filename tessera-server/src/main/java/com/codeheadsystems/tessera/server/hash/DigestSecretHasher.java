package com.codeheadsystems.tessera.server.hash;

import com.codeheadsystems.tessera.server.exceptions.HashException;
import com.codeheadsystems.tessera.server.model.HashedSecret;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic, unsalted SHA-256 {@link SecretHasher}.
 * <p>
 * A pure function of its input: the same secret always yields the same hash, which makes stored
 * hashes directly comparable in tests. Session secrets are already high-entropy, but this hasher
 * gives no protection against a leaked store being precomputed against. Dev/test only.
 */
public class DigestSecretHasher implements SecretHasher {

  private static final String PREFIX = "sha256$";
  private static final HexFormat HEX = HexFormat.of();

  @Override
  public HashedSecret hash(String plain) {
    return new HashedSecret(PREFIX + HEX.formatHex(digest(plain)));
  }

  @Override
  public boolean verify(String plain, HashedSecret hashed) {
    if (plain == null || hashed == null || !hashed.value().startsWith(PREFIX)) {
      return false;
    }
    byte[] expected;
    try {
      expected = HEX.parseHex(hashed.value().substring(PREFIX.length()));
    } catch (IllegalArgumentException e) {
      return false;
    }
    return MessageDigest.isEqual(digest(plain), expected);
  }

  private static byte[] digest(String plain) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(plain.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new HashException("SHA-256 unavailable", e);
    }
  }
}
