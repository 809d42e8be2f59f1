package com.codeheadsystems.geni.client.exceptions;

/**
 * The type Authentication exception. Carries the {@link Reason} an authentication operation
 * failed so callers can react without parsing messages.
 */
public class AuthenticationException extends RuntimeException {

  private final Reason reason;

  /**
   * Instantiates a new Authentication exception.
   *
   * @param reason  the reason
   * @param message the message
   */
  public AuthenticationException(final Reason reason, final String message) {
    super(message);
    this.reason = reason;
  }

  /**
   * Instantiates a new Authentication exception.
   *
   * @param reason  the reason
   * @param message the message
   * @param cause   the cause
   */
  public AuthenticationException(final Reason reason, final String message, final Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  /**
   * Reason reason.
   *
   * @return the reason
   */
  public Reason reason() {
    return reason;
  }

  /**
   * Why an authentication operation failed.
   */
  public enum Reason {
    /** Wrong password or username, or an expired challenge session. */
    INVALID_CREDENTIALS,
    /** The user does not exist in the pool. */
    USER_NOT_FOUND,
    /** The user has not confirmed their account. */
    USER_NOT_CONFIRMED,
    /** The provider asked for a challenge this client does not support. */
    UNEXPECTED_CHALLENGE,
    /** A required field was missing from a provider response. */
    MALFORMED_RESPONSE,
    /** The SRP exchange produced an invalid value. */
    PROTOCOL_VIOLATION,
    /** The provider could not be reached. */
    NETWORK_FAILURE,
    /** Any other provider error. */
    PROVIDER_ERROR,
    /** The refresh token was rejected. */
    REFRESH_FAILED,
    /** The new password was not accepted. */
    PASSWORD_CHANGE_FAILED,
    /** No usable tokens are stored. */
    NOT_AUTHENTICATED
  }
}
