package com.codeheadsystems.tessera.server.model;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * High-entropy session secret held in memory only while a session is being opened or verified.
 * <p>
 * A raw secret is embedded in the session token handed to the caller and otherwise discarded.
 * It must never be persisted or logged; {@link #toString()} is redacted for that reason.
 *
 * @param bytes the secret bytes (copied on the way in and out)
 */
public record RawSecret(byte[] bytes) {

  private static final Base64.Encoder B64 = Base64.getUrlEncoder().withoutPadding();

  public RawSecret {
    Objects.requireNonNull(bytes, "bytes");
    if (bytes.length == 0) {
      throw new IllegalArgumentException("RawSecret must not be empty");
    }
    bytes = bytes.clone();
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  /**
   * Number of bytes in the secret.
   *
   * @return the length
   */
  public int length() {
    return bytes.length;
  }

  /**
   * The string form fed to a {@link com.codeheadsystems.tessera.server.hash.SecretHasher}.
   *
   * @return URL-safe, unpadded base64 of the secret bytes
   */
  public String encoded() {
    return B64.encodeToString(bytes);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RawSecret other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "RawSecret[" + bytes.length + " bytes, redacted]";
  }
}
