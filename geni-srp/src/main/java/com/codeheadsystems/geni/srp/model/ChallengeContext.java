package com.codeheadsystems.geni.srp.model;

/**
 * The {@code PASSWORD_VERIFIER} challenge parameters returned by the identity provider.
 *
 * @param usernameForSrp    the server-chosen username ({@code USER_ID_FOR_SRP}); echoed back
 *                          and used in the proof instead of the login identifier
 * @param saltHex           the salt as hex ({@code SALT})
 * @param serverPublicKeyHex the server public value B as hex ({@code SRP_B})
 * @param secretBlock       the opaque base64 secret block ({@code SECRET_BLOCK})
 */
public record ChallengeContext(String usernameForSrp,
                               String saltHex,
                               String serverPublicKeyHex,
                               String secretBlock) {

  /**
   * Validates that every parameter was supplied.
   */
  public ChallengeContext {
    requirePresent(usernameForSrp, "USER_ID_FOR_SRP");
    requirePresent(saltHex, "SALT");
    requirePresent(serverPublicKeyHex, "SRP_B");
    requirePresent(secretBlock, "SECRET_BLOCK");
  }

  private static void requirePresent(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing challenge parameter: " + name);
    }
  }
}
