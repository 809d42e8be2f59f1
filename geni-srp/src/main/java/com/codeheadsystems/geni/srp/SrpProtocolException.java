package com.codeheadsystems.geni.srp;

/**
 * Thrown when the server's values violate the SRP-6a protocol, such as a zero scrambling
 * parameter {@code u}. The attempt cannot continue and is not retried.
 */
public class SrpProtocolException extends RuntimeException {

  /**
   * Instantiates a new Srp protocol exception.
   *
   * @param message the message
   */
  public SrpProtocolException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Srp protocol exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SrpProtocolException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
