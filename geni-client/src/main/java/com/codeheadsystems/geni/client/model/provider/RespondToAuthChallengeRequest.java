package com.codeheadsystems.geni.client.model.provider;

import com.codeheadsystems.geni.srp.model.PasswordClaim;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.HashMap;
import java.util.Map;

/**
 * Body of a {@code RespondToAuthChallenge} call.
 * <p>
 * Used by: {@code AWSCognitoIdentityProviderService.RespondToAuthChallenge}
 *
 * @param challengeName      the challenge being answered
 * @param clientId           the app client id
 * @param challengeResponses the answer
 * @param session            the session from the challenge, omitted when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RespondToAuthChallengeRequest(
    @JsonProperty("ChallengeName") String challengeName,
    @JsonProperty("ClientId") String clientId,
    @JsonProperty("ChallengeResponses") Map<String, String> challengeResponses,
    @JsonProperty("Session") String session) {

  /**
   * Answers a {@code PASSWORD_VERIFIER} challenge with the SRP proof.
   *
   * @param clientId the client id
   * @param claim    the computed claim
   * @param session  the session from the initiate call, may be null
   * @return the request
   */
  public static RespondToAuthChallengeRequest passwordVerifier(String clientId,
                                                               PasswordClaim claim,
                                                               String session) {
    Map<String, String> responses = new HashMap<>();
    responses.put("USERNAME", claim.usernameForSrp());
    responses.put("PASSWORD_CLAIM_SECRET_BLOCK", claim.secretBlock());
    responses.put("PASSWORD_CLAIM_SIGNATURE", claim.signature());
    responses.put("TIMESTAMP", claim.timestamp());
    return new RespondToAuthChallengeRequest(AuthChallengeResponse.PASSWORD_VERIFIER, clientId,
        Map.copyOf(responses), session);
  }

  /**
   * Answers a {@code NEW_PASSWORD_REQUIRED} challenge.
   *
   * @param clientId    the client id
   * @param userId      the user the challenge was issued to
   * @param newPassword the new password
   * @param session     the session from the challenge
   * @return the request
   */
  public static RespondToAuthChallengeRequest newPasswordRequired(String clientId,
                                                                  String userId,
                                                                  String newPassword,
                                                                  String session) {
    return new RespondToAuthChallengeRequest(AuthChallengeResponse.NEW_PASSWORD_REQUIRED, clientId,
        Map.of("USERNAME", userId, "NEW_PASSWORD", newPassword), session);
  }

  @Override
  public String toString() {
    return "RespondToAuthChallengeRequest[challengeName=" + challengeName + ", clientId=" + clientId + "]";
  }
}
