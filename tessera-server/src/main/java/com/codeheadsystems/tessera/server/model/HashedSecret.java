package com.codeheadsystems.tessera.server.model;

import java.util.Objects;

/**
 * One-way derived representation of a {@link RawSecret}. Safe to persist.
 *
 * @param value the encoded hash, in whatever format the producing hasher defines
 */
public record HashedSecret(String value) {

  public HashedSecret {
    Objects.requireNonNull(value, "value");
  }
}
