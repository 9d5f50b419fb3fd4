package com.codeheadsystems.tessera.server.token;

import com.codeheadsystems.tessera.server.exceptions.MalformedTokenException;
import com.codeheadsystems.tessera.server.model.RawSecret;
import com.codeheadsystems.tessera.server.model.SessionId;
import com.codeheadsystems.tessera.server.model.SessionTokenPayload;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encodes the opaque session bearer token: {@code base64url(sessionId) "." base64url(secret)}.
 * <p>
 * The token is not signed. It proves nothing on its own; a decoded payload is only trusted once
 * its secret verifies against the hash stored for the session.
 */
public class SessionTokenCodec {

  private static final char SEPARATOR = '.';
  private static final Base64.Encoder B64 = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder B64D = Base64.getUrlDecoder();

  /**
   * Encodes a payload.
   *
   * @param payload session id and raw secret
   * @return the bearer string
   */
  public String encode(SessionTokenPayload payload) {
    return B64.encodeToString(payload.sessionId().value().getBytes(StandardCharsets.UTF_8))
        + SEPARATOR
        + B64.encodeToString(payload.secret().bytes());
  }

  /**
   * Recovers the session id and raw secret from a bearer string.
   *
   * @param token the bearer string
   * @return the payload
   * @throws MalformedTokenException if the string is not a session token
   */
  public SessionTokenPayload decode(String token) {
    if (token == null || token.isBlank()) {
      throw new MalformedTokenException("Session token is empty");
    }
    int dot = token.indexOf(SEPARATOR);
    if (dot <= 0 || dot == token.length() - 1 || token.indexOf(SEPARATOR, dot + 1) >= 0) {
      throw new MalformedTokenException("Session token must have exactly two parts");
    }
    try {
      String id = new String(B64D.decode(token.substring(0, dot)), StandardCharsets.UTF_8);
      byte[] secret = B64D.decode(token.substring(dot + 1));
      return new SessionTokenPayload(new SessionId(id), new RawSecret(secret));
    } catch (IllegalArgumentException e) {
      throw new MalformedTokenException("Session token is not valid base64url", e);
    }
  }
}
