package com.codeheadsystems.geni.client.exceptions;

/**
 * The type Malformed response exception. The identity provider answered, but the body could not
 * be read.
 */
public class MalformedResponseException extends IdentityProviderAccessorException {
  /**
   * Instantiates a new Malformed response exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public MalformedResponseException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
