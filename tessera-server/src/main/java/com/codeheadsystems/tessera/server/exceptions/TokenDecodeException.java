package com.codeheadsystems.tessera.server.exceptions;

/**
 * A token could not be decoded into trusted claims.
 * <p>
 * Subtypes separate the cases a caller reacts to differently: {@link ExpiredTokenException}
 * (prompt re-authentication), {@link InvalidSignatureException} and
 * {@link MalformedTokenException} (reject outright).
 */
public abstract class TokenDecodeException extends TesseraException {

  protected TokenDecodeException(final String message) {
    super(message);
  }

  protected TokenDecodeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
