package com.codeheadsystems.geni.client.exceptions;

/**
 * An error reported by the identity provider itself, such as {@code NotAuthorizedException}.
 * <p>
 * The error type is the short name: for a wire value of
 * {@code com.amazonaws.cognito#UserNotFoundException} it is {@code UserNotFoundException}.
 */
public class IdentityProviderException extends RuntimeException {

  private final String errorType;
  private final int statusCode;

  /**
   * Instantiates a new Identity provider exception.
   *
   * @param errorType  the short error type
   * @param message    the provider's message
   * @param statusCode the HTTP status code
   */
  public IdentityProviderException(final String errorType, final String message, final int statusCode) {
    super(message);
    this.errorType = errorType;
    this.statusCode = statusCode;
  }

  /**
   * Error type string.
   *
   * @return the short error type, or {@code Unknown} if the provider did not name one
   */
  public String errorType() {
    return errorType;
  }

  /**
   * Status code int.
   *
   * @return the HTTP status code
   */
  public int statusCode() {
    return statusCode;
  }
}
