package com.codeheadsystems.geni.client.model.provider;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Body of an {@code InitiateAuth} call.
 * <p>
 * Used by: {@code AWSCognitoIdentityProviderService.InitiateAuth}
 *
 * @param authFlow       {@code USER_SRP_AUTH} or {@code REFRESH_TOKEN_AUTH}
 * @param clientId       the app client id
 * @param authParameters the flow parameters
 */
public record InitiateAuthRequest(
    @JsonProperty("AuthFlow") String authFlow,
    @JsonProperty("ClientId") String clientId,
    @JsonProperty("AuthParameters") Map<String, String> authParameters) {

  /**
   * The SRP login flow.
   */
  public static final String USER_SRP_AUTH = "USER_SRP_AUTH";
  /**
   * The refresh flow.
   */
  public static final String REFRESH_TOKEN_AUTH = "REFRESH_TOKEN_AUTH";

  /**
   * Starts an SRP login.
   *
   * @param clientId the client id
   * @param username the login identifier
   * @param srpA     the client public value A as hex
   * @return the initiate auth request
   */
  public static InitiateAuthRequest userSrpAuth(String clientId, String username, String srpA) {
    return new InitiateAuthRequest(USER_SRP_AUTH, clientId,
        Map.of("USERNAME", username, "SRP_A", srpA));
  }

  /**
   * Exchanges a refresh token for new tokens.
   *
   * @param clientId     the client id
   * @param refreshToken the refresh token
   * @return the initiate auth request
   */
  public static InitiateAuthRequest refreshTokenAuth(String clientId, String refreshToken) {
    return new InitiateAuthRequest(REFRESH_TOKEN_AUTH, clientId,
        Map.of("REFRESH_TOKEN", refreshToken));
  }

  @Override
  public String toString() {
    return "InitiateAuthRequest[authFlow=" + authFlow + ", clientId=" + clientId + "]";
  }
}
