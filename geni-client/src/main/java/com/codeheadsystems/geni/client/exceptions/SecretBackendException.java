package com.codeheadsystems.geni.client.exceptions;

/**
 * The type Secret backend exception.
 */
public class SecretBackendException extends RuntimeException {
  /**
   * Instantiates a new Secret backend exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SecretBackendException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
