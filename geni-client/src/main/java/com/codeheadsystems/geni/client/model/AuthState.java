package com.codeheadsystems.geni.client.model;

/**
 * Where a login attempt stands.
 */
public enum AuthState {
  UNAUTHENTICATED,
  SRP_INITIATED,
  AWAITING_PASSWORD_VERIFIER_RESULT,
  NEW_PASSWORD_REQUIRED,
  AUTHENTICATED,
  LOGGED_OUT
}
