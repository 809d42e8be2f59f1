package com.codeheadsystems.geni.client.model.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tokens issued by the identity provider. A refresh response carries no refresh token.
 *
 * @param accessToken  the access token
 * @param idToken      the id token
 * @param refreshToken the refresh token, null on refresh
 * @param expiresIn    lifetime in seconds
 * @param tokenType    normally {@code Bearer}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthenticationResult(
    @JsonProperty("AccessToken") String accessToken,
    @JsonProperty("IdToken") String idToken,
    @JsonProperty("RefreshToken") String refreshToken,
    @JsonProperty("ExpiresIn") Integer expiresIn,
    @JsonProperty("TokenType") String tokenType) {

  @Override
  public String toString() {
    return "AuthenticationResult[expiresIn=" + expiresIn + ", tokenType=" + tokenType + "]";
  }
}
