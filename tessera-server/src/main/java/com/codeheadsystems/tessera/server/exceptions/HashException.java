package com.codeheadsystems.tessera.server.exceptions;

/**
 * Catastrophic secret hasher failure. Never raised for well-formed input.
 */
public class HashException extends TesseraException {

  /**
   * Instantiates a new hash exception.
   *
   * @param message the message
   */
  public HashException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new hash exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public HashException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
