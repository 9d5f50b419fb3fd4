package com.codeheadsystems.tessera.server.exceptions;

/**
 * A user's permission set could not be resolved.
 */
public class PermissionLookupException extends TesseraException {

  /**
   * Instantiates a new permission lookup exception.
   *
   * @param message the message
   */
  public PermissionLookupException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new permission lookup exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public PermissionLookupException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
