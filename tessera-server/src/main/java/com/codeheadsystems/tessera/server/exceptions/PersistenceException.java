package com.codeheadsystems.tessera.server.exceptions;

/**
 * The session store could not complete a write. Retry policy belongs to the caller.
 */
public class PersistenceException extends TesseraException {

  /**
   * Instantiates a new persistence exception.
   *
   * @param message the message
   */
  public PersistenceException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new persistence exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public PersistenceException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
