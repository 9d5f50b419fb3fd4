package com.codeheadsystems.tessera.server.model;

import java.util.Objects;

/**
 * Unique, immutable identity of a {@link Session}.
 *
 * @param value the identifier, never blank
 */
public record SessionId(String value) {

  public SessionId {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("SessionId must not be blank");
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
