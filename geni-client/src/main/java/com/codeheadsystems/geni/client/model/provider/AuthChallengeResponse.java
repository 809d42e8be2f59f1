package com.codeheadsystems.geni.client.model.provider;

import com.codeheadsystems.geni.srp.model.ChallengeContext;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Response to both {@code InitiateAuth} and {@code RespondToAuthChallenge}: either another
 * challenge or an {@link AuthenticationResult}.
 *
 * @param challengeName        the next challenge, or null when tokens were issued
 * @param challengeParameters  the challenge parameters
 * @param session              the session to echo back with the answer
 * @param authenticationResult the tokens, or null when a challenge follows
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthChallengeResponse(
    @JsonProperty("ChallengeName") String challengeName,
    @JsonProperty("ChallengeParameters") Map<String, String> challengeParameters,
    @JsonProperty("Session") String session,
    @JsonProperty("AuthenticationResult") AuthenticationResult authenticationResult) {

  /**
   * The SRP proof challenge.
   */
  public static final String PASSWORD_VERIFIER = "PASSWORD_VERIFIER";
  /**
   * The forced password change challenge.
   */
  public static final String NEW_PASSWORD_REQUIRED = "NEW_PASSWORD_REQUIRED";

  /**
   * Challenge parameter.
   *
   * @param name the parameter name
   * @return the value, or null
   */
  public String challengeParameter(String name) {
    return challengeParameters == null ? null : challengeParameters.get(name);
  }

  /**
   * The {@code PASSWORD_VERIFIER} parameters.
   *
   * @return the challenge context
   * @throws IllegalArgumentException if a parameter is missing
   */
  public ChallengeContext challengeContext() {
    return new ChallengeContext(
        challengeParameter("USER_ID_FOR_SRP"),
        challengeParameter("SALT"),
        challengeParameter("SRP_B"),
        challengeParameter("SECRET_BLOCK"));
  }

  @Override
  public String toString() {
    return "AuthChallengeResponse[challengeName=" + challengeName
        + ", authenticated=" + (authenticationResult != null) + "]";
  }
}
