package com.codeheadsystems.geni.client.model;

import java.util.function.Function;

/**
 * The result of a successful credential check: either tokens, or a demand for a new password.
 * <p>
 * Use {@link #map(Function, Function)} to handle both cases.
 */
public interface AuthOutcome {

  /**
   * Applies the function matching this outcome.
   *
   * @param <T>                      the result type
   * @param onAuthenticated          called with tokens
   * @param onPasswordChangeRequired called when a new password must be set
   * @return the function's result
   */
  <T> T map(Function<Authenticated, T> onAuthenticated,
            Function<PasswordChangeRequired, T> onPasswordChangeRequired);

  /**
   * The user is logged in and the tokens were stored.
   *
   * @param tokens the tokens
   */
  record Authenticated(AuthTokens tokens) implements AuthOutcome {

    @Override
    public <T> T map(Function<Authenticated, T> onAuthenticated,
                     Function<PasswordChangeRequired, T> onPasswordChangeRequired) {
      return onAuthenticated.apply(this);
    }
  }

  /**
   * The password was correct but must be replaced before tokens are issued.
   *
   * @param session the provider session to answer the challenge with
   * @param userId  the user id the challenge is addressed to
   */
  record PasswordChangeRequired(String session, String userId) implements AuthOutcome {

    @Override
    public <T> T map(Function<Authenticated, T> onAuthenticated,
                     Function<PasswordChangeRequired, T> onPasswordChangeRequired) {
      return onPasswordChangeRequired.apply(this);
    }

    @Override
    public String toString() {
      return "PasswordChangeRequired[userId=" + userId + "]";
    }
  }
}
