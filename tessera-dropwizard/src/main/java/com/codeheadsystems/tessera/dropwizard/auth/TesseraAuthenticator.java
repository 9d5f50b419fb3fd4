package com.codeheadsystems.tessera.dropwizard.auth;

import com.codeheadsystems.tessera.server.auth.SignedTokenCodec;
import com.codeheadsystems.tessera.server.exceptions.TokenDecodeException;
import com.codeheadsystems.tessera.server.model.AccessTokenClaims;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that validates access tokens using {@link SignedTokenCodec}.
 * Expired, forged and malformed tokens all yield no principal.
 */
public class TesseraAuthenticator implements Authenticator<String, TesseraPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(TesseraAuthenticator.class);

  private final SignedTokenCodec signedTokenCodec;

  /**
   * Instantiates a new Tessera authenticator.
   *
   * @param signedTokenCodec the access token codec
   */
  public TesseraAuthenticator(SignedTokenCodec signedTokenCodec) {
    this.signedTokenCodec = signedTokenCodec;
  }

  @Override
  public Optional<TesseraPrincipal> authenticate(String token) throws AuthenticationException {
    try {
      AccessTokenClaims claims = signedTokenCodec.decode(token);
      return Optional.of(new TesseraPrincipal(claims.userId().value(), claims.permissions()));
    } catch (TokenDecodeException e) {
      log.debug("Rejected access token: {}", e.getClass().getSimpleName());
      return Optional.empty();
    }
  }
}
