package com.codeheadsystems.geni.client.exceptions;

/**
 * The type Token storage exception. Raised only when no storage backend could complete the
 * operation.
 */
public class TokenStorageException extends RuntimeException {
  /**
   * Instantiates a new Token storage exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TokenStorageException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
