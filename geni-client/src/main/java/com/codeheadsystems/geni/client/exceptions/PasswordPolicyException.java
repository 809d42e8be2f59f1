package com.codeheadsystems.geni.client.exceptions;

/**
 * The type Password policy exception. The new password was rejected by the pool's password
 * policy.
 */
public class PasswordPolicyException extends AuthenticationException {

  /**
   * The requirements of the pool's password policy, as shown to users.
   */
  public static final String POLICY_DESCRIPTION =
      "Password must be at least 12 characters and include uppercase, lowercase, and numbers";

  /**
   * Instantiates a new Password policy exception.
   *
   * @param cause the provider error
   */
  public PasswordPolicyException(final Throwable cause) {
    super(Reason.PASSWORD_CHANGE_FAILED, POLICY_DESCRIPTION, cause);
  }
}
