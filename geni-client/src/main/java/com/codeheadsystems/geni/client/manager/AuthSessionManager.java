package com.codeheadsystems.geni.client.manager;

import com.codeheadsystems.geni.client.accessor.CognitoIdentityProviderAccessor;
import com.codeheadsystems.geni.client.config.IdentityProviderConfig;
import com.codeheadsystems.geni.client.exceptions.AuthenticationException;
import com.codeheadsystems.geni.client.exceptions.AuthenticationException.Reason;
import com.codeheadsystems.geni.client.exceptions.IdentityProviderAccessorException;
import com.codeheadsystems.geni.client.exceptions.IdentityProviderException;
import com.codeheadsystems.geni.client.exceptions.MalformedResponseException;
import com.codeheadsystems.geni.client.exceptions.PasswordPolicyException;
import com.codeheadsystems.geni.client.model.AuthOutcome;
import com.codeheadsystems.geni.client.model.AuthState;
import com.codeheadsystems.geni.client.model.AuthTokens;
import com.codeheadsystems.geni.client.model.IdTokenClaims;
import com.codeheadsystems.geni.client.model.provider.AuthChallengeResponse;
import com.codeheadsystems.geni.client.model.provider.AuthenticationResult;
import com.codeheadsystems.geni.client.model.provider.InitiateAuthRequest;
import com.codeheadsystems.geni.client.model.provider.RespondToAuthChallengeRequest;
import com.codeheadsystems.geni.client.store.TokenStore;
import com.codeheadsystems.geni.srp.ClaimTimestamp;
import com.codeheadsystems.geni.srp.ProofComputer;
import com.codeheadsystems.geni.srp.SrpKeyExchange;
import com.codeheadsystems.geni.srp.SrpProtocolException;
import com.codeheadsystems.geni.srp.model.ChallengeContext;
import com.codeheadsystems.geni.srp.model.PasswordClaim;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level orchestrator for Cognito login, token refresh and logout.
 * <p>
 * Coordinates the SRP math (via {@link ProofComputer}) with the HTTP transport (via
 * {@link CognitoIdentityProviderAccessor}) and persists the result in the {@link TokenStore}.
 * Callers deal only with identifiers, passwords and tokens.
 * <p>
 * <strong>Login:</strong>
 * <ol>
 *   <li>Client generates the ephemeral pair (a, A) and sends A with the identifier.</li>
 *   <li>Provider answers with the {@code PASSWORD_VERIFIER} challenge: salt, B and a secret block.</li>
 *   <li>Client derives the session key, signs the claim and sends it. The provider returns tokens
 *       or asks for a new password.</li>
 * </ol>
 * Provider errors are reported as {@link AuthenticationException} with a {@link Reason}.
 */
@Singleton
public class AuthSessionManager {

  private static final Logger log = LoggerFactory.getLogger(AuthSessionManager.class);

  private final IdentityProviderConfig config;
  private final CognitoIdentityProviderAccessor accessor;
  private final TokenStore tokenStore;
  private final SrpKeyExchange keyExchange;
  private final ProofComputer proofComputer;
  private final Clock clock;

  private volatile AuthState state = AuthState.UNAUTHENTICATED;

  /**
   * Instantiates a new Auth session manager.
   *
   * @param config      the identity provider config
   * @param accessor    the accessor
   * @param tokenStore  the token store
   * @param keyExchange the key exchange
   * @param clock       the clock
   */
  @Inject
  public AuthSessionManager(final IdentityProviderConfig config,
                            final CognitoIdentityProviderAccessor accessor,
                            final TokenStore tokenStore,
                            final SrpKeyExchange keyExchange,
                            final Clock clock) {
    log.info("AuthSessionManager({})", config.userPoolId());
    this.config = config;
    this.accessor = accessor;
    this.tokenStore = tokenStore;
    this.keyExchange = keyExchange;
    this.proofComputer = new ProofComputer(keyExchange.group(), config.userPoolId());
    this.clock = clock;
  }

  /**
   * Runs the SRP login. On success the tokens are stored before they are returned.
   *
   * @param identifier the login identifier, usually an email address
   * @param password   the password
   * @return tokens, or a password-change demand
   * @throws AuthenticationException if the login fails
   */
  public AuthOutcome login(final String identifier, final String password) {
    log.debug("login()");
    requireValue(identifier, "Email is required");
    requireValue(password, "Password is required");

    try (LoginAttempt attempt = new LoginAttempt(keyExchange.generate())) {
      AuthOutcome outcome;
      try {
        outcome = runLogin(attempt, identifier, password);
      } catch (RuntimeException e) {
        state = AuthState.UNAUTHENTICATED;
        throw e;
      }
      state = attempt.state();
      return outcome;
    }
  }

  private AuthOutcome runLogin(LoginAttempt attempt, String identifier, String password) {
    try {
      // Step 1: send A and receive the PASSWORD_VERIFIER challenge
      AuthChallengeResponse challengeResponse = accessor.initiateAuth(
          InitiateAuthRequest.userSrpAuth(config.clientId(), identifier, attempt.publicKeyHex()));
      attempt.initiated();
      if (!AuthChallengeResponse.PASSWORD_VERIFIER.equals(challengeResponse.challengeName())) {
        throw new AuthenticationException(Reason.UNEXPECTED_CHALLENGE,
            "Unexpected challenge: " + challengeResponse.challengeName());
      }
      ChallengeContext challenge = challengeResponse.challengeContext();

      // Step 2: derive the session key and sign the claim
      PasswordClaim claim = attempt.computeClaim(proofComputer, challenge, password,
          ClaimTimestamp.now(clock));

      // Step 3: send the claim and receive tokens or a new challenge
      AuthChallengeResponse verifierResponse = accessor.respondToAuthChallenge(
          RespondToAuthChallengeRequest.passwordVerifier(config.clientId(), claim,
              challengeResponse.session()));

      if (AuthChallengeResponse.NEW_PASSWORD_REQUIRED.equals(verifierResponse.challengeName())) {
        attempt.finish(AuthState.NEW_PASSWORD_REQUIRED);
        return passwordChangeRequired(verifierResponse, identifier);
      }
      AuthenticationResult result = verifierResponse.authenticationResult();
      if (result == null) {
        if (verifierResponse.challengeName() != null) {
          throw new AuthenticationException(Reason.UNEXPECTED_CHALLENGE,
              "Unexpected challenge: " + verifierResponse.challengeName());
        }
        throw new AuthenticationException(Reason.MALFORMED_RESPONSE,
            "Authentication failed: no tokens returned");
      }
      AuthTokens tokens = newTokens(result, result.refreshToken(), null, identifier);
      tokenStore.store(tokens);
      attempt.finish(AuthState.AUTHENTICATED);
      log.debug("login succeeded (userId={})", tokens.userId());
      return new AuthOutcome.Authenticated(tokens);
    } catch (IdentityProviderException e) {
      throw classify(e, Reason.PROVIDER_ERROR);
    } catch (MalformedResponseException e) {
      throw new AuthenticationException(Reason.MALFORMED_RESPONSE, e.getMessage(), e);
    } catch (IdentityProviderAccessorException e) {
      throw new AuthenticationException(Reason.NETWORK_FAILURE, e.getMessage(), e);
    } catch (SrpProtocolException e) {
      throw new AuthenticationException(Reason.PROTOCOL_VIOLATION, e.getMessage(), e);
    } catch (IllegalArgumentException e) {
      throw new AuthenticationException(Reason.MALFORMED_RESPONSE, e.getMessage(), e);
    }
  }

  /**
   * Answers a {@code NEW_PASSWORD_REQUIRED} challenge and stores the resulting tokens.
   *
   * @param session     the session from {@link AuthOutcome.PasswordChangeRequired}
   * @param userId      the user id from {@link AuthOutcome.PasswordChangeRequired}
   * @param newPassword the new password
   * @param email       the identifier the user logged in with
   * @return the tokens
   * @throws PasswordPolicyException if the password does not meet the pool's policy
   * @throws AuthenticationException if the change fails for any other reason
   */
  public AuthTokens completePasswordChange(final String session,
                                           final String userId,
                                           final String newPassword,
                                           final String email) {
    log.debug("completePasswordChange(userId={})", userId);
    requireValue(session, "Session is required");
    requireValue(userId, "User id is required");
    requireValue(newPassword, "Password is required");
    try {
      AuthChallengeResponse response = accessor.respondToAuthChallenge(
          RespondToAuthChallengeRequest.newPasswordRequired(config.clientId(), userId, newPassword, session));
      AuthenticationResult result = response.authenticationResult();
      if (result == null) {
        throw new AuthenticationException(Reason.PASSWORD_CHANGE_FAILED,
            "Password change failed: no tokens returned");
      }
      AuthTokens tokens = newTokens(result, result.refreshToken(), null, email);
      tokenStore.store(tokens);
      state = AuthState.AUTHENTICATED;
      return tokens;
    } catch (IdentityProviderException e) {
      if ("InvalidPasswordException".equals(e.errorType())) {
        throw new PasswordPolicyException(e);
      }
      throw classify(e, Reason.PASSWORD_CHANGE_FAILED);
    } catch (MalformedResponseException e) {
      throw new AuthenticationException(Reason.MALFORMED_RESPONSE, e.getMessage(), e);
    } catch (IdentityProviderAccessorException e) {
      throw new AuthenticationException(Reason.NETWORK_FAILURE, e.getMessage(), e);
    }
  }

  /**
   * Exchanges a refresh token for new access and id tokens and stores them. The refresh token
   * is kept, and the user id and email come from the stored tokens when present.
   *
   * @param refreshToken the refresh token
   * @return the refreshed tokens
   * @throws AuthenticationException with {@link Reason#REFRESH_FAILED} if the token is rejected
   */
  public AuthTokens refresh(final String refreshToken) {
    log.debug("refresh()");
    requireValue(refreshToken, "Refresh token is required");
    try {
      AuthChallengeResponse response = accessor.initiateAuth(
          InitiateAuthRequest.refreshTokenAuth(config.clientId(), refreshToken));
      AuthenticationResult result = response.authenticationResult();
      if (result == null) {
        throw new AuthenticationException(Reason.REFRESH_FAILED, "Token refresh failed: no tokens returned");
      }
      Optional<AuthTokens> stored = tokenStore.load();
      AuthTokens tokens = newTokens(result, refreshToken,
          stored.map(AuthTokens::userId).orElse(null),
          stored.map(AuthTokens::email).orElse(""));
      tokenStore.store(tokens);
      state = AuthState.AUTHENTICATED;
      return tokens;
    } catch (IdentityProviderException e) {
      throw new AuthenticationException(Reason.REFRESH_FAILED, "Token refresh failed: " + e.getMessage(), e);
    } catch (MalformedResponseException e) {
      throw new AuthenticationException(Reason.MALFORMED_RESPONSE, e.getMessage(), e);
    } catch (IdentityProviderAccessorException e) {
      throw new AuthenticationException(Reason.NETWORK_FAILURE, e.getMessage(), e);
    }
  }

  /**
   * Returns usable tokens, refreshing them first if they are expired. Never throws: a failed
   * refresh gives empty.
   *
   * @return the tokens, or empty if the user must log in
   */
  public Optional<AuthTokens> getCurrentTokens() {
    log.debug("getCurrentTokens()");
    Optional<AuthTokens> stored = tokenStore.load();
    if (stored.isEmpty()) {
      return Optional.empty();
    }
    AuthTokens tokens = stored.get();
    if (!tokens.isExpired(clock)) {
      return stored;
    }
    try {
      return Optional.of(refresh(tokens.refreshToken()));
    } catch (RuntimeException e) {
      log.warn("Token refresh failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Is authenticated boolean.
   *
   * @return true if {@link #getCurrentTokens()} yields tokens
   */
  public boolean isAuthenticated() {
    return getCurrentTokens().isPresent();
  }

  /**
   * Removes stored tokens.
   */
  public void logout() {
    log.debug("logout()");
    tokenStore.clear();
    state = AuthState.LOGGED_OUT;
  }

  /**
   * State of the most recent operation in this process.
   *
   * @return the state
   */
  public AuthState state() {
    return state;
  }

  private AuthOutcome passwordChangeRequired(AuthChallengeResponse response, String identifier) {
    String session = response.session();
    if (session == null || session.isBlank()) {
      throw new AuthenticationException(Reason.MALFORMED_RESPONSE,
          "NEW_PASSWORD_REQUIRED challenge without a session");
    }
    String userId = response.challengeParameter("USER_ID_FOR_SRP");
    if (userId == null || userId.isBlank()) {
      userId = identifier;
    }
    log.debug("login requires a new password (userId={})", userId);
    return new AuthOutcome.PasswordChangeRequired(session, userId);
  }

  private AuthTokens newTokens(AuthenticationResult result, String refreshToken, String userId, String email) {
    if (result.accessToken() == null || result.idToken() == null || refreshToken == null
        || result.expiresIn() == null) {
      throw new AuthenticationException(Reason.MALFORMED_RESPONSE,
          "Authentication result is missing required fields");
    }
    Instant expiresAt = clock.instant().plusSeconds(result.expiresIn());
    String resolvedUserId = (userId == null || userId.isBlank())
        ? IdTokenClaims.decode(result.idToken()).subject()
        : userId;
    return new AuthTokens(result.accessToken(), result.idToken(), refreshToken, expiresAt,
        resolvedUserId, email == null ? "" : email);
  }

  private static AuthenticationException classify(IdentityProviderException e, Reason fallback) {
    String errorType = e.errorType() == null ? "" : e.errorType();
    Reason reason = switch (errorType) {
      case "NotAuthorizedException" -> Reason.INVALID_CREDENTIALS;
      case "UserNotFoundException" -> Reason.USER_NOT_FOUND;
      case "UserNotConfirmedException" -> Reason.USER_NOT_CONFIRMED;
      default -> fallback;
    };
    String message = switch (reason) {
      case INVALID_CREDENTIALS -> "Invalid email or password";
      case USER_NOT_FOUND -> "User not found";
      case USER_NOT_CONFIRMED -> "User account not confirmed";
      default -> errorType + ": " + e.getMessage();
    };
    return new AuthenticationException(reason, message, e);
  }

  private static void requireValue(String value, String message) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException(message);
    }
  }
}
