package com.codeheadsystems.geni.client.model;

import com.auth0.jwt.JWT;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.interfaces.DecodedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The identity claims read from an id token. The signature is not checked: the token came
 * straight from the identity provider over TLS.
 *
 * @param subject the {@code sub} claim, or empty
 * @param email   the {@code email} claim, or empty
 */
public record IdTokenClaims(String subject, String email) {

  /**
   * Claims of a token that could not be read.
   */
  public static final IdTokenClaims EMPTY = new IdTokenClaims("", "");

  private static final Logger log = LoggerFactory.getLogger(IdTokenClaims.class);

  /**
   * Decodes the payload of an id token. Undecodable tokens give {@link #EMPTY}.
   *
   * @param idToken the id token
   * @return the claims
   */
  public static IdTokenClaims decode(String idToken) {
    if (idToken == null || idToken.isBlank()) {
      return EMPTY;
    }
    try {
      DecodedJWT jwt = JWT.decode(idToken);
      String email = jwt.getClaim("email").asString();
      return new IdTokenClaims(
          jwt.getSubject() == null ? "" : jwt.getSubject(),
          email == null ? "" : email);
    } catch (JWTDecodeException e) {
      log.warn("Unable to decode id token: {}", e.getMessage());
      return EMPTY;
    }
  }
}
