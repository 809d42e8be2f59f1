package com.codeheadsystems.geni.srp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

import com.codeheadsystems.geni.srp.config.SrpGroup;
import com.codeheadsystems.geni.srp.model.ChallengeContext;
import com.codeheadsystems.geni.srp.model.PasswordClaim;
import com.codeheadsystems.geni.srp.model.SrpKeyPair;
import java.math.BigInteger;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ProofComputer}. Proofs are checked against {@link SrpTestServer}, which
 * derives the key from the verifier side of the exchange.
 */
class ProofComputerTest {

  private static final String USER_POOL_ID = "ap-southeast-2_TestPool1";
  private static final String USERNAME_FOR_SRP = "8f3c1e2a-0000-4000-8000-1234567890ab";
  private static final String PASSWORD = "Correct-Horse-Battery-9";
  private static final String TIMESTAMP = "Tue Mar 04 09:05:01 UTC 2025";

  private final SrpKeyExchange keyExchange = new SrpKeyExchange();
  private ProofComputer proofComputer;
  private SrpTestServer server;

  @BeforeEach
  void setUp() {
    proofComputer = new ProofComputer(USER_POOL_ID);
    server = new SrpTestServer("TestPool1", USERNAME_FOR_SRP, PASSWORD);
  }

  @Test
  void poolName_isSegmentAfterFirstUnderscore() {
    assertThat(ProofComputer.poolName("us-east-1_AbC_dEf")).isEqualTo("AbC_dEf");
    assertThat(proofComputer.poolName()).isEqualTo("TestPool1");
  }

  @Test
  void poolName_withoutUnderscore_isWholeId() {
    assertThat(ProofComputer.poolName("PlainPool")).isEqualTo("PlainPool");
  }

  @Test
  void poolName_blankThrows() {
    assertThatThrownBy(() -> ProofComputer.poolName(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void computeClaim_correctPassword_isAcceptedByServer() {
    SrpKeyPair keyPair = keyExchange.generate();

    PasswordClaim claim = proofComputer.computeClaim(keyPair, server.challenge(), PASSWORD, TIMESTAMP);

    assertThat(server.verify(keyPair.publicKey(), claim)).isTrue();
    assertThat(proofComputer.deriveKey(keyPair, server.challenge(), PASSWORD))
        .hasSize(ProofComputer.DERIVED_KEY_LENGTH)
        .isEqualTo(server.deriveKey(keyPair.publicKey()));
  }

  @Test
  void computeClaim_wrongPassword_isRejectedByServer() {
    SrpKeyPair keyPair = keyExchange.generate();

    PasswordClaim claim = proofComputer.computeClaim(keyPair, server.challenge(), "wrong-password", TIMESTAMP);

    assertThat(server.verify(keyPair.publicKey(), claim)).isFalse();
  }

  @Test
  void computeClaim_wrongPoolName_isRejectedByServer() {
    SrpKeyPair keyPair = keyExchange.generate();
    ProofComputer otherPool = new ProofComputer("ap-southeast-2_OtherPool");

    PasswordClaim claim = otherPool.computeClaim(keyPair, server.challenge(), PASSWORD, TIMESTAMP);

    assertThat(server.verify(keyPair.publicKey(), claim)).isFalse();
  }

  @Test
  void computeClaim_isDeterministicForFixedInputs() {
    SrpKeyPair keyPair = keyExchange.generate();
    ChallengeContext challenge = server.challenge();

    PasswordClaim first = proofComputer.computeClaim(keyPair, challenge, PASSWORD, TIMESTAMP);
    PasswordClaim second = new ProofComputer(USER_POOL_ID).computeClaim(keyPair, challenge, PASSWORD, TIMESTAMP);

    assertThat(second).isEqualTo(first);
  }

  @Test
  void computeClaim_echoesServerValuesUnchanged() {
    SrpKeyPair keyPair = keyExchange.generate();
    ChallengeContext challenge = server.challenge();

    PasswordClaim claim = proofComputer.computeClaim(keyPair, challenge, PASSWORD, TIMESTAMP);

    assertThat(claim.timestamp()).isEqualTo(TIMESTAMP);
    assertThat(claim.usernameForSrp()).isEqualTo(USERNAME_FOR_SRP);
    assertThat(claim.secretBlock()).isEqualTo(challenge.secretBlock());
    assertThat(Base64.getDecoder().decode(claim.signature())).hasSize(32);
  }

  @Test
  void computeClaim_timestampIsSigned() {
    SrpKeyPair keyPair = keyExchange.generate();
    ChallengeContext challenge = server.challenge();

    PasswordClaim a = proofComputer.computeClaim(keyPair, challenge, PASSWORD, TIMESTAMP);
    PasswordClaim b = proofComputer.computeClaim(keyPair, challenge, PASSWORD, "Tue Mar 04 09:05:02 UTC 2025");

    assertThat(a.signature()).isNotEqualTo(b.signature());
  }

  @Test
  void computeClaim_zeroU_failsWithProtocolViolation() {
    ProofComputer crafted = spy(new ProofComputer(USER_POOL_ID));
    doReturn(BigInteger.ZERO).when(crafted).computeU(any(), any());

    assertThatThrownBy(() -> crafted.computeClaim(keyExchange.generate(), server.challenge(), PASSWORD, TIMESTAMP))
        .isInstanceOf(SrpProtocolException.class)
        .hasMessageContaining("u is zero");
  }

  @Test
  void computeClaim_serverValueZeroModN_failsWithProtocolViolation() {
    ChallengeContext challenge = new ChallengeContext(USERNAME_FOR_SRP, "abcd",
        SrpGroup.RFC5054_3072.n().toString(16), "AAAA");

    assertThatThrownBy(() -> proofComputer.computeClaim(keyExchange.generate(), challenge, PASSWORD, TIMESTAMP))
        .isInstanceOf(SrpProtocolException.class)
        .hasMessageContaining("zero mod N");
  }

  @Test
  void computeClaim_malformedSecretBlock_failsWithProtocolViolation() {
    ChallengeContext good = server.challenge();
    ChallengeContext challenge = new ChallengeContext(good.usernameForSrp(), good.saltHex(),
        good.serverPublicKeyHex(), "not*base64");

    assertThatThrownBy(() -> proofComputer.computeClaim(keyExchange.generate(), challenge, PASSWORD, TIMESTAMP))
        .isInstanceOf(SrpProtocolException.class)
        .hasMessageContaining("SECRET_BLOCK");
  }

  @Test
  void computeClaim_malformedSaltHex_isValidationError() {
    ChallengeContext good = server.challenge();
    ChallengeContext challenge = new ChallengeContext(good.usernameForSrp(), "xyz",
        good.serverPublicKeyHex(), good.secretBlock());

    assertThatThrownBy(() -> proofComputer.computeClaim(keyExchange.generate(), challenge, PASSWORD, TIMESTAMP))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void challengeContext_missingParameterThrows() {
    assertThatThrownBy(() -> new ChallengeContext(USERNAME_FOR_SRP, "ab", null, "AAAA"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("SRP_B");
  }
}
