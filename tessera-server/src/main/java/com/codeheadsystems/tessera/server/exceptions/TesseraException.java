package com.codeheadsystems.tessera.server.exceptions;

/**
 * Base type of every failure raised by the session lifecycle.
 */
public class TesseraException extends RuntimeException {

  /**
   * Instantiates a new tessera exception.
   *
   * @param message the message
   */
  public TesseraException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new tessera exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TesseraException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
