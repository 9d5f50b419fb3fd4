package com.codeheadsystems.tessera.server.exceptions;

/**
 * A session token does not match a live session.
 * <p>
 * Unknown sessions and wrong secrets raise the same exception with the same message so the
 * caller learns nothing about which session ids exist.
 */
public class InvalidSessionException extends SecurityException {

  public InvalidSessionException(final String message) {
    super(message);
  }

  public InvalidSessionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
