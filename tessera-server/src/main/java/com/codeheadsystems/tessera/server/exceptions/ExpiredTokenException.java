package com.codeheadsystems.tessera.server.exceptions;

/**
 * The token is authentic but its expiry has passed.
 */
public class ExpiredTokenException extends TokenDecodeException {

  public ExpiredTokenException(final String message) {
    super(message);
  }

  public ExpiredTokenException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
