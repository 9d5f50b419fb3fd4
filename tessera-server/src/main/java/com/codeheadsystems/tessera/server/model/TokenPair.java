package com.codeheadsystems.tessera.server.model;

import java.time.Instant;

/**
 * The two bearer artifacts returned when a session is opened.
 *
 * @param accessToken          short-lived signed token carrying permission claims
 * @param sessionToken         long-lived opaque token bound to the stored secret hash
 * @param sessionId            id of the session backing {@code sessionToken}
 * @param accessTokenExpiresAt expiry of {@code accessToken}
 */
public record TokenPair(
    String accessToken,
    String sessionToken,
    SessionId sessionId,
    Instant accessTokenExpiresAt) {

  @Override
  public String toString() {
    return "TokenPair[sessionId=" + sessionId + ", accessTokenExpiresAt=" + accessTokenExpiresAt + "]";
  }
}
