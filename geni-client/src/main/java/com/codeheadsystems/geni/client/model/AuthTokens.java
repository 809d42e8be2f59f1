package com.codeheadsystems.geni.client.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * The tokens issued for an authenticated user.
 * <p>
 * Tokens count as expired five minutes before their real expiry so that a token handed to a
 * caller is still valid when it reaches the server.
 *
 * @param accessToken  the access token
 * @param idToken      the id token, used as the bearer credential
 * @param refreshToken the long-lived refresh token
 * @param expiresAt    when the access and id tokens expire
 * @param userId       the user's stable id (the id token subject)
 * @param email        the identifier the user logged in with
 */
public record AuthTokens(String accessToken,
                         String idToken,
                         String refreshToken,
                         Instant expiresAt,
                         String userId,
                         String email) {

  /**
   * How long before {@link #expiresAt()} the tokens are treated as expired.
   */
  public static final Duration EXPIRY_BUFFER = Duration.ofMinutes(5);

  /**
   * Instantiates new tokens.
   *
   * @throws IllegalArgumentException if {@code expiresAt} is null
   */
  public AuthTokens {
    if (expiresAt == null) {
      throw new IllegalArgumentException("expiresAt must be set");
    }
  }

  /**
   * Expired at the given instant, buffer included. Exactly five minutes before expiry is
   * already expired.
   *
   * @param now the current instant
   * @return true if the tokens should be refreshed
   */
  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt.minus(EXPIRY_BUFFER));
  }

  /**
   * Is expired boolean.
   *
   * @param clock the clock
   * @return true if the tokens should be refreshed
   */
  public boolean isExpired(Clock clock) {
    return isExpired(clock.instant());
  }

  @Override
  public String toString() {
    return "AuthTokens[userId=" + userId + ", email=" + email + ", expiresAt=" + expiresAt + "]";
  }
}
