package com.codeheadsystems.tessera.server.model;

import java.util.Objects;

/**
 * Opaque identifier of an already-authenticated user.
 *
 * @param value the identifier, never blank
 */
public record UserId(String value) {

  public UserId {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("UserId must not be blank");
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
