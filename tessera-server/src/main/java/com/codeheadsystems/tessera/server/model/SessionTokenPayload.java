package com.codeheadsystems.tessera.server.model;

import java.util.Objects;

/**
 * Contents of an opaque session token: which session, and the secret proving ownership of it.
 *
 * @param sessionId the session
 * @param secret    the raw secret whose hash the session stores
 */
public record SessionTokenPayload(SessionId sessionId, RawSecret secret) {

  public SessionTokenPayload {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(secret, "secret");
  }
}
