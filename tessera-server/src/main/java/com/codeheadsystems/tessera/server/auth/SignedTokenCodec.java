package com.codeheadsystems.tessera.server.auth;

import com.codeheadsystems.tessera.server.exceptions.ExpiredTokenException;
import com.codeheadsystems.tessera.server.exceptions.InvalidSignatureException;
import com.codeheadsystems.tessera.server.exceptions.MalformedTokenException;
import com.codeheadsystems.tessera.server.model.AccessTokenClaims;

/**
 * Encodes access token claims into a signed, self-contained string and back.
 * <p>
 * Access tokens are never looked up server-side, so the signature and the embedded expiry are
 * the only things a decoder may trust. Implementations must check the signature before the
 * expiry and must judge expiry against an injected clock.
 */
public interface SignedTokenCodec {

  /**
   * Signs the claims.
   *
   * @param claims the claims
   * @return the token string
   */
  String encode(AccessTokenClaims claims);

  /**
   * Verifies and decodes a token.
   *
   * @param token the token string
   * @return the claims it carries
   * @throws ExpiredTokenException     if the signature verifies but the expiry has passed
   * @throws InvalidSignatureException if the signature does not verify
   * @throws MalformedTokenException   if the string is not a token this codec issued
   */
  AccessTokenClaims decode(String token);
}
