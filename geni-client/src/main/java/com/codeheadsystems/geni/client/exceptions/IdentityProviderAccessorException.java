package com.codeheadsystems.geni.client.exceptions;

/**
 * The type Identity provider accessor exception. Raised when the identity provider could not be
 * reached or its response could not be read.
 */
public class IdentityProviderAccessorException extends RuntimeException {
  /**
   * Instantiates a new Identity provider accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public IdentityProviderAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
