package com.codeheadsystems.tessera.server.model;

/**
 * A signed access token together with the claims it was minted from.
 *
 * @param token  the encoded bearer string
 * @param claims the claims signed into it
 */
public record AccessToken(String token, AccessTokenClaims claims) {

  @Override
  public String toString() {
    return "AccessToken[" + claims + "]";
  }
}
