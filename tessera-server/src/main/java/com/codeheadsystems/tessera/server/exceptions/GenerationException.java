package com.codeheadsystems.tessera.server.exceptions;

/**
 * The entropy source or identifier generator failed. Fatal for the call; never retried internally.
 */
public class GenerationException extends TesseraException {

  /**
   * Instantiates a new generation exception.
   *
   * @param message the message
   */
  public GenerationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new generation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public GenerationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
