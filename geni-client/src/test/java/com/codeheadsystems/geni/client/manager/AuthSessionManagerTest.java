package com.codeheadsystems.geni.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

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
import com.codeheadsystems.geni.client.model.provider.AuthChallengeResponse;
import com.codeheadsystems.geni.client.model.provider.AuthenticationResult;
import com.codeheadsystems.geni.client.model.provider.InitiateAuthRequest;
import com.codeheadsystems.geni.client.model.provider.RespondToAuthChallengeRequest;
import com.codeheadsystems.geni.client.store.InMemorySecretBackend;
import com.codeheadsystems.geni.client.store.TokenStore;
import com.codeheadsystems.geni.srp.SrpKeyExchange;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link AuthSessionManager}.
 * <p>
 * Uses the real SRP client math against {@link FakeCognito}, which verifies password claims
 * from the pool's side, while the {@link CognitoIdentityProviderAccessor} HTTP layer is mocked.
 */
@ExtendWith(MockitoExtension.class)
class AuthSessionManagerTest {

  private static final String EMAIL = "alice@example.com";
  private static final String PASSWORD = "Correct-Horse-Battery-9";
  private static final Instant NOW = Instant.parse("2025-03-04T09:05:01Z");
  private static final IdentityProviderConfig CONFIG =
      IdentityProviderConfig.of(FakeCognito.USER_POOL_ID, FakeCognito.CLIENT_ID, "ap-southeast-2");

  @Mock private CognitoIdentityProviderAccessor accessor;

  private TokenStore tokenStore;
  private FakeCognito cognito;
  private AuthSessionManager manager;

  @BeforeEach
  void setUp() {
    tokenStore = new TokenStore(null, new InMemorySecretBackend(), new ObjectMapper());
    cognito = new FakeCognito(EMAIL, PASSWORD);
    manager = new AuthSessionManager(CONFIG, accessor, tokenStore, new SrpKeyExchange(),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private void stubCognito() {
    when(accessor.initiateAuth(any())).thenAnswer(inv -> cognito.initiateAuth(inv.getArgument(0)));
    when(accessor.respondToAuthChallenge(any()))
        .thenAnswer(inv -> cognito.respondToAuthChallenge(inv.getArgument(0)));
  }

  private AuthTokens storedTokens(Instant expiresAt) {
    AuthTokens tokens = new AuthTokens("old-access", "old-id", "refresh-original", expiresAt,
        "stored-user-id", "stored@example.com");
    tokenStore.store(tokens);
    return tokens;
  }

  // ── Login ─────────────────────────────────────────────────────────────────

  @Test
  void login_correctPassword_storesTokensForLoginEmail() {
    stubCognito();

    AuthOutcome outcome = manager.login(EMAIL, PASSWORD);

    assertThat(outcome).isInstanceOf(AuthOutcome.Authenticated.class);
    AuthTokens tokens = ((AuthOutcome.Authenticated) outcome).tokens();
    assertThat(tokens.email()).isEqualTo(EMAIL);
    assertThat(tokens.userId()).isEqualTo(FakeCognito.SUBJECT);
    assertThat(tokens.refreshToken()).isEqualTo("refresh-1");
    assertThat(tokens.expiresAt()).isEqualTo(NOW.plusSeconds(FakeCognito.EXPIRES_IN));
    assertThat(tokenStore.load()).contains(tokens);
    assertThat(manager.state()).isEqualTo(AuthState.AUTHENTICATED);
  }

  @Test
  void login_sendsClientIdAndEchoesServerUsername() {
    stubCognito();

    manager.login(EMAIL, PASSWORD);

    ArgumentCaptor<InitiateAuthRequest> initiate = ArgumentCaptor.forClass(InitiateAuthRequest.class);
    verify(accessor).initiateAuth(initiate.capture());
    assertThat(initiate.getValue().authFlow()).isEqualTo("USER_SRP_AUTH");
    assertThat(initiate.getValue().clientId()).isEqualTo(FakeCognito.CLIENT_ID);
    assertThat(initiate.getValue().authParameters()).containsEntry("USERNAME", EMAIL);

    ArgumentCaptor<RespondToAuthChallengeRequest> respond =
        ArgumentCaptor.forClass(RespondToAuthChallengeRequest.class);
    verify(accessor).respondToAuthChallenge(respond.capture());
    assertThat(respond.getValue().challengeResponses())
        .containsEntry("USERNAME", FakeCognito.USERNAME_FOR_SRP)
        .containsEntry("TIMESTAMP", "Tue Mar 04 09:05:01 UTC 2025");
  }

  @Test
  void login_wrongPassword_isInvalidCredentials() {
    stubCognito();

    assertThatThrownBy(() -> manager.login(EMAIL, "wrong-password"))
        .isInstanceOfSatisfying(AuthenticationException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.INVALID_CREDENTIALS));
    assertThat(tokenStore.load()).isEmpty();
    assertThat(manager.state()).isEqualTo(AuthState.UNAUTHENTICATED);
  }

  @Test
  void login_unknownUser_isUserNotFound() {
    when(accessor.initiateAuth(any())).thenAnswer(inv -> cognito.initiateAuth(inv.getArgument(0)));

    assertThatThrownBy(() -> manager.login("bob@example.com", PASSWORD))
        .isInstanceOfSatisfying(AuthenticationException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.USER_NOT_FOUND));
  }

  @ParameterizedTest
  @CsvSource({
      "NotAuthorizedException, INVALID_CREDENTIALS",
      "UserNotFoundException, USER_NOT_FOUND",
      "UserNotConfirmedException, USER_NOT_CONFIRMED",
      "TooManyRequestsException, PROVIDER_ERROR",
      "InternalErrorException, PROVIDER_ERROR"
  })
  void login_providerErrors_areClassified(String errorType, Reason expected) {
    when(accessor.initiateAuth(any())).thenThrow(new IdentityProviderException(errorType, "boom", 400));

    assertThatThrownBy(() -> manager.login(EMAIL, PASSWORD))
        .isInstanceOfSatisfying(AuthenticationException.class, e -> {
          assertThat(e.reason()).isEqualTo(expected);
          assertThat(e.getCause()).isInstanceOf(IdentityProviderException.class);
        });
  }

  @Test
  void login_networkFailure() {
    when(accessor.initiateAuth(any()))
        .thenThrow(new IdentityProviderAccessorException("InitiateAuth request failed", new IOException("down")));

    assertThatThrownBy(() -> manager.login(EMAIL, PASSWORD))
        .isInstanceOfSatisfying(AuthenticationException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.NETWORK_FAILURE));
  }

  @Test
  void login_unreadableResponse_isMalformed() {
    when(accessor.initiateAuth(any()))
        .thenThrow(new MalformedResponseException("InitiateAuth returned an unreadable body", null));

    assertThatThrownBy(() -> manager.login(EMAIL, PASSWORD))
        .isInstanceOfSatisfying(AuthenticationException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.MALFORMED_RESPONSE));
  }

  @Test
  void login_unexpectedChallenge() {
    when(accessor.initiateAuth(any()))
        .thenReturn(new AuthChallengeResponse("CUSTOM_CHALLENGE", Map.of(), "s", null));

    assertThatThrownBy(() -> manager.login(EMAIL, PASSWORD))
        .isInstanceOfSatisfying(AuthenticationException.class, e -> {
          assertThat(e.reason()).isEqualTo(Reason.UNEXPECTED_CHALLENGE);
          assertThat(e.getMessage()).contains("CUSTOM_CHALLENGE");
        });
    verify(accessor, never()).respondToAuthChallenge(any());
  }

  @Test
  void login_missingChallengeParameter_isMalformed() {
    when(accessor.initiateAuth(any())).thenReturn(new AuthChallengeResponse("PASSWORD_VERIFIER",
        Map.of("USER_ID_FOR_SRP", "uid", "SALT", "ab", "SRP_B", "cd"), null, null));

    assertThatThrownBy(() -> manager.login(EMAIL, PASSWORD))
        .isInstanceOfSatisfying(AuthenticationException.class, e -> {
          assertThat(e.reason()).isEqualTo(Reason.MALFORMED_RESPONSE);
          assertThat(e.getMessage()).contains("SECRET_BLOCK");
        });
  }

  @Test
  void login_serverValueZeroModN_isProtocolViolation() {
    when(accessor.initiateAuth(any())).thenReturn(new AuthChallengeResponse("PASSWORD_VERIFIER",
        Map.of("USER_ID_FOR_SRP", "uid", "SALT", "ab", "SRP_B", "0", "SECRET_BLOCK", "c2VjcmV0"), null, null));

    assertThatThrownBy(() -> manager.login(EMAIL, PASSWORD))
        .isInstanceOfSatisfying(AuthenticationException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.PROTOCOL_VIOLATION));
    verify(accessor, never()).respondToAuthChallenge(any());
  }

  @Test
  void login_noTokensAndNoChallenge_isMalformed() {
    when(accessor.initiateAuth(any())).thenAnswer(inv -> cognito.initiateAuth(inv.getArgument(0)));
    when(accessor.respondToAuthChallenge(any())).thenReturn(new AuthChallengeResponse(null, Map.of(), null, null));

    assertThatThrownBy(() -> manager.login(EMAIL, PASSWORD))
        .isInstanceOfSatisfying(AuthenticationException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.MALFORMED_RESPONSE));
  }

  @Test
  void login_followUpChallengeOtherThanNewPassword_isUnexpected() {
    when(accessor.initiateAuth(any())).thenAnswer(inv -> cognito.initiateAuth(inv.getArgument(0)));
    when(accessor.respondToAuthChallenge(any()))
        .thenReturn(new AuthChallengeResponse("SOFTWARE_TOKEN_MFA", Map.of(), "s", null));

    assertThatThrownBy(() -> manager.login(EMAIL, PASSWORD))
        .isInstanceOfSatisfying(AuthenticationException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.UNEXPECTED_CHALLENGE));
  }

  @Test
  void login_blankEmail_isRejectedBeforeAnyCall() {
    assertThatThrownBy(() -> manager.login("", PASSWORD))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(accessor);
  }

  // ── New password ──────────────────────────────────────────────────────────

  @Test
  void login_newPasswordRequired_thenComplete() {
    cognito.requireNewPassword();
    stubCognito();

    AuthOutcome outcome = manager.login(EMAIL, PASSWORD);

    assertThat(outcome).isInstanceOf(AuthOutcome.PasswordChangeRequired.class);
    AuthOutcome.PasswordChangeRequired change = (AuthOutcome.PasswordChangeRequired) outcome;
    assertThat(change.session()).isEqualTo(FakeCognito.NEW_PASSWORD_SESSION);
    assertThat(change.userId()).isEqualTo(FakeCognito.USERNAME_FOR_SRP);
    assertThat(manager.state()).isEqualTo(AuthState.NEW_PASSWORD_REQUIRED);
    assertThat(tokenStore.load()).isEmpty();

    AuthTokens tokens = manager.completePasswordChange(change.session(), change.userId(),
        "Brand-New-Passw0rd", EMAIL);

    assertThat(tokens.email()).isEqualTo(EMAIL);
    assertThat(tokens.userId()).isEqualTo(FakeCognito.SUBJECT);
    assertThat(tokenStore.load()).contains(tokens);
    assertThat(manager.state()).isEqualTo(AuthState.AUTHENTICATED);
  }

  @Test
  void newPasswordChallengeWithoutUserId_fallsBackToLoginIdentifier() {
    when(accessor.initiateAuth(any())).thenAnswer(inv -> cognito.initiateAuth(inv.getArgument(0)));
    when(accessor.respondToAuthChallenge(any())).thenReturn(new AuthChallengeResponse(
        AuthChallengeResponse.NEW_PASSWORD_REQUIRED, Map.of(), "sess", null));

    AuthOutcome outcome = manager.login(EMAIL, PASSWORD);

    assertThat(outcome.map(a -> null, AuthOutcome.PasswordChangeRequired::userId)).isEqualTo(EMAIL);
  }

  @Test
  void completePasswordChange_policyRejection() {
    when(accessor.respondToAuthChallenge(any())).thenThrow(new IdentityProviderException(
        "InvalidPasswordException", "Password does not conform to policy", 400));

    assertThatThrownBy(() -> manager.completePasswordChange("sess", "uid", "short", EMAIL))
        .isInstanceOf(PasswordPolicyException.class)
        .hasMessageContaining("at least 12 characters");
  }

  @Test
  void completePasswordChange_expiredSession_isInvalidCredentials() {
    when(accessor.respondToAuthChallenge(any()))
        .thenAnswer(inv -> cognito.respondToAuthChallenge(inv.getArgument(0)));

    assertThatThrownBy(() -> manager.completePasswordChange("stale", "uid", "Brand-New-Passw0rd", EMAIL))
        .isInstanceOfSatisfying(AuthenticationException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.INVALID_CREDENTIALS));
  }

  @Test
  void completePasswordChange_noTokens_fails() {
    when(accessor.respondToAuthChallenge(any())).thenReturn(new AuthChallengeResponse(null, Map.of(), null, null));

    assertThatThrownBy(() -> manager.completePasswordChange("sess", "uid", "Brand-New-Passw0rd", EMAIL))
        .isInstanceOfSatisfying(AuthenticationException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.PASSWORD_CHANGE_FAILED));
  }

  @Test
  void completePasswordChange_missingUserId_isRejectedBeforeAnyCall() {
    assertThatThrownBy(() -> manager.completePasswordChange("sess", null, "Brand-New-Passw0rd", EMAIL))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("User id is required");
    verifyNoInteractions(accessor);
  }

  // ── Refresh and current tokens ────────────────────────────────────────────

  @Test
  void getCurrentTokens_nothingStored_isEmpty() {
    assertThat(manager.getCurrentTokens()).isEmpty();
    assertThat(manager.isAuthenticated()).isFalse();
  }

  @Test
  void getCurrentTokens_fresh_returnsStoredWithoutNetwork() {
    AuthTokens stored = storedTokens(NOW.plus(Duration.ofMinutes(6)));

    assertThat(manager.getCurrentTokens()).contains(stored);
    verifyNoInteractions(accessor);
  }

  @Test
  void getCurrentTokens_insideExpiryBuffer_refreshesAndKeepsIdentity() {
    storedTokens(NOW.plus(Duration.ofMinutes(4)));
    when(accessor.initiateAuth(any())).thenAnswer(inv -> cognito.initiateAuth(inv.getArgument(0)));

    Optional<AuthTokens> current = manager.getCurrentTokens();

    assertThat(current).isPresent();
    AuthTokens tokens = current.get();
    assertThat(tokens.accessToken()).isEqualTo("access-1");
    assertThat(tokens.refreshToken()).isEqualTo("refresh-original");
    assertThat(tokens.userId()).isEqualTo("stored-user-id");
    assertThat(tokens.email()).isEqualTo("stored@example.com");
    assertThat(tokens.expiresAt()).isEqualTo(NOW.plusSeconds(FakeCognito.EXPIRES_IN));
    assertThat(tokenStore.load()).contains(tokens);

    ArgumentCaptor<InitiateAuthRequest> captor = ArgumentCaptor.forClass(InitiateAuthRequest.class);
    verify(accessor).initiateAuth(captor.capture());
    assertThat(captor.getValue().authFlow()).isEqualTo("REFRESH_TOKEN_AUTH");
    assertThat(captor.getValue().authParameters()).containsEntry("REFRESH_TOKEN", "refresh-original");
  }

  @Test
  void getCurrentTokens_refreshRejected_isEmptyNotError() {
    storedTokens(NOW.minus(Duration.ofHours(1)));
    when(accessor.initiateAuth(any())).thenThrow(new IdentityProviderException(
        "NotAuthorizedException", "Refresh Token has expired", 400));

    assertThat(manager.getCurrentTokens()).isEmpty();
    assertThat(manager.isAuthenticated()).isFalse();
  }

  @Test
  void getCurrentTokens_refreshNetworkFailure_isEmpty() {
    storedTokens(NOW.minus(Duration.ofHours(1)));
    when(accessor.initiateAuth(any()))
        .thenThrow(new IdentityProviderAccessorException("timeout", new IOException("timeout")));

    assertThat(manager.getCurrentTokens()).isEmpty();
  }

  @Test
  void refresh_rejected_isRefreshFailed() {
    when(accessor.initiateAuth(any())).thenThrow(new IdentityProviderException(
        "NotAuthorizedException", "Invalid Refresh Token", 400));

    assertThatThrownBy(() -> manager.refresh("refresh-x"))
        .isInstanceOfSatisfying(AuthenticationException.class, e -> {
          assertThat(e.reason()).isEqualTo(Reason.REFRESH_FAILED);
          assertThat(e.getMessage()).contains("Invalid Refresh Token");
        });
  }

  @Test
  void refresh_withoutStoredTokens_takesUserIdFromIdToken() {
    when(accessor.initiateAuth(any())).thenReturn(new AuthChallengeResponse(null, Map.of(), null,
        new AuthenticationResult("acc", cognito.idToken(), null, 600, "Bearer")));

    AuthTokens tokens = manager.refresh("refresh-x");

    assertThat(tokens.userId()).isEqualTo(FakeCognito.SUBJECT);
    assertThat(tokens.email()).isEmpty();
    assertThat(tokens.refreshToken()).isEqualTo("refresh-x");
  }

  // ── Logout ────────────────────────────────────────────────────────────────

  @Test
  void logout_clearsTokens() {
    storedTokens(NOW.plus(Duration.ofHours(1)));
    assertThat(manager.isAuthenticated()).isTrue();

    manager.logout();

    assertThat(manager.isAuthenticated()).isFalse();
    assertThat(manager.state()).isEqualTo(AuthState.LOGGED_OUT);
  }
}
