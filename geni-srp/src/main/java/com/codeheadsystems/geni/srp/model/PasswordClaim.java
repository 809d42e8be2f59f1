package com.codeheadsystems.geni.srp.model;

/**
 * The client's answer to a {@code PASSWORD_VERIFIER} challenge.
 *
 * @param signature      base64 HMAC-SHA256 proof ({@code PASSWORD_CLAIM_SIGNATURE})
 * @param timestamp      the exact timestamp text that was signed ({@code TIMESTAMP})
 * @param usernameForSrp the server-chosen username to echo back ({@code USERNAME})
 * @param secretBlock    the unmodified secret block ({@code PASSWORD_CLAIM_SECRET_BLOCK})
 */
public record PasswordClaim(String signature, String timestamp, String usernameForSrp, String secretBlock) {
}
