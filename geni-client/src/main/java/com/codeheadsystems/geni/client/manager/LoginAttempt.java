package com.codeheadsystems.geni.client.manager;

import com.codeheadsystems.geni.client.model.AuthState;
import com.codeheadsystems.geni.srp.ProofComputer;
import com.codeheadsystems.geni.srp.model.ChallengeContext;
import com.codeheadsystems.geni.srp.model.PasswordClaim;
import com.codeheadsystems.geni.srp.model.SrpKeyPair;

/**
 * One pass through the SRP login. Holds the ephemeral key pair until the password claim has
 * been computed, and tracks the attempt's {@link AuthState}.
 * <p>
 * The key pair answers exactly one challenge and is dropped on {@link #close()}.
 */
class LoginAttempt implements AutoCloseable {

  private SrpKeyPair keyPair;
  private AuthState state;

  LoginAttempt(final SrpKeyPair keyPair) {
    this.keyPair = keyPair;
    this.state = AuthState.UNAUTHENTICATED;
  }

  String publicKeyHex() {
    return requireKeyPair().publicKeyHex();
  }

  void initiated() {
    transition(AuthState.UNAUTHENTICATED, AuthState.SRP_INITIATED);
  }

  PasswordClaim computeClaim(final ProofComputer proofComputer,
                             final ChallengeContext challenge,
                             final String password,
                             final String timestamp) {
    transition(AuthState.SRP_INITIATED, AuthState.AWAITING_PASSWORD_VERIFIER_RESULT);
    PasswordClaim claim = proofComputer.computeClaim(requireKeyPair(), challenge, password, timestamp);
    keyPair = null;
    return claim;
  }

  void finish(final AuthState outcome) {
    transition(AuthState.AWAITING_PASSWORD_VERIFIER_RESULT, outcome);
  }

  AuthState state() {
    return state;
  }

  @Override
  public void close() {
    keyPair = null;
  }

  private SrpKeyPair requireKeyPair() {
    if (keyPair == null) {
      throw new IllegalStateException("Login attempt key pair already used");
    }
    return keyPair;
  }

  private void transition(AuthState from, AuthState to) {
    if (state != from) {
      throw new IllegalStateException("Cannot move to " + to + " from " + state);
    }
    state = to;
  }
}
