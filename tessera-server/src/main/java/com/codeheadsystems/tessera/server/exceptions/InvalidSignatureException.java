package com.codeheadsystems.tessera.server.exceptions;

/**
 * The token's signature does not verify against the signing key.
 */
public class InvalidSignatureException extends TokenDecodeException {

  public InvalidSignatureException(final String message) {
    super(message);
  }

  public InvalidSignatureException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
