package com.codeheadsystems.geni.client.manager;

import com.codeheadsystems.geni.client.exceptions.AuthenticationException;
import com.codeheadsystems.geni.client.model.AuthTokens;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Supplies the id token that authenticated API calls send as their bearer credential.
 */
@Singleton
public class BearerTokenProvider {

  private final AuthSessionManager authSessionManager;

  /**
   * Instantiates a new Bearer token provider.
   *
   * @param authSessionManager the auth session manager
   */
  @Inject
  public BearerTokenProvider(final AuthSessionManager authSessionManager) {
    this.authSessionManager = authSessionManager;
  }

  /**
   * The current id token, refreshed if needed.
   *
   * @return the token, or empty if not logged in
   */
  public Optional<String> bearerToken() {
    return authSessionManager.getCurrentTokens().map(AuthTokens::idToken);
  }

  /**
   * The current id token.
   *
   * @return the token
   * @throws AuthenticationException with {@code NOT_AUTHENTICATED} if not logged in
   */
  public String requireBearerToken() {
    return bearerToken().orElseThrow(() -> new AuthenticationException(
        AuthenticationException.Reason.NOT_AUTHENTICATED,
        "Authentication required. Run 'geni login' to authenticate."));
  }
}
