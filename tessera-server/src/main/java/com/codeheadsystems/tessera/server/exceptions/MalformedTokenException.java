package com.codeheadsystems.tessera.server.exceptions;

/**
 * The token is not structurally valid or is missing required claims.
 */
public class MalformedTokenException extends TokenDecodeException {

  public MalformedTokenException(final String message) {
    super(message);
  }

  public MalformedTokenException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
