package com.codeheadsystems.geni.client.store;

import com.codeheadsystems.geni.client.model.AuthTokens;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Persisted form of {@link AuthTokens}. {@code expires_at} is in epoch seconds; a missing value
 * reads as already expired.
 *
 * @param accessToken  the access token
 * @param idToken      the id token
 * @param refreshToken the refresh token
 * @param expiresAt    expiry in epoch seconds, may be null
 * @param userId       the user id
 * @param email        the login identifier
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredTokens(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("id_token") String idToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("expires_at") Double expiresAt,
    @JsonProperty("user_id") String userId,
    @JsonProperty("email") String email) {

  /**
   * Instantiates the persisted form of the given tokens.
   *
   * @param tokens the tokens
   */
  public StoredTokens(AuthTokens tokens) {
    this(tokens.accessToken(), tokens.idToken(), tokens.refreshToken(),
        tokens.expiresAt().toEpochMilli() / 1000.0,
        tokens.userId(), tokens.email());
  }

  /**
   * Auth tokens.
   *
   * @return the tokens
   * @throws IllegalArgumentException if a token is missing
   */
  public AuthTokens authTokens() {
    return new AuthTokens(
        require(accessToken, "access_token"),
        require(idToken, "id_token"),
        require(refreshToken, "refresh_token"),
        expiresAt == null ? Instant.EPOCH : Instant.ofEpochMilli(Math.round(expiresAt * 1000)),
        userId == null ? "" : userId,
        email == null ? "" : email);
  }

  private static String require(String value, String name) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("Missing stored field: " + name);
    }
    return value;
  }

  @Override
  public String toString() {
    return "StoredTokens[userId=" + userId + ", expiresAt=" + expiresAt + "]";
  }
}
