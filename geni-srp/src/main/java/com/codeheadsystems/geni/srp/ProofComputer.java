package com.codeheadsystems.geni.srp;

import static com.codeheadsystems.geni.srp.common.ByteUtils.concat;
import static com.codeheadsystems.geni.srp.common.ByteUtils.paddedBytes;

import com.codeheadsystems.geni.srp.common.ByteUtils;
import com.codeheadsystems.geni.srp.config.SrpGroup;
import com.codeheadsystems.geni.srp.internal.SrpCrypto;
import com.codeheadsystems.geni.srp.model.ChallengeContext;
import com.codeheadsystems.geni.srp.model.PasswordClaim;
import com.codeheadsystems.geni.srp.model.SrpKeyPair;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Computes the {@code PASSWORD_CLAIM_SIGNATURE} for a Cognito {@code PASSWORD_VERIFIER}
 * challenge.
 * <p>
 * The steps, with {@code PAD} meaning the bytes of the padded hex encoding:
 * <ol>
 *   <li>{@code u = H(PAD(A) || PAD(B))}; zero is a protocol violation.</li>
 *   <li>{@code x = H(PAD(salt) || H(poolName || username || ":" || password))}</li>
 *   <li>{@code S = (B - k * g^x)^(a + u * x) mod N}</li>
 *   <li>{@code key = HKDF(salt = PAD(u), ikm = PAD(S), info = "Caldera Derived Key")[0..16]}</li>
 *   <li>{@code signature = HMAC(key, poolName || username || secretBlock || timestamp)}</li>
 * </ol>
 * Pool name, username and timestamp enter the final MAC as UTF-8 text; the secret block enters
 * as its base64-decoded bytes.
 */
public class ProofComputer {

  /**
   * HKDF info label fixed by the identity provider.
   */
  public static final byte[] DERIVED_KEY_INFO = "Caldera Derived Key".getBytes(StandardCharsets.UTF_8);

  /**
   * Length of the derived signing key.
   */
  public static final int DERIVED_KEY_LENGTH = 16;

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final SrpGroup group;
  private final String poolName;

  /**
   * Instantiates a new Proof computer for the Cognito group.
   *
   * @param userPoolId the user pool id, e.g. {@code ap-southeast-2_AbCdEf}
   */
  public ProofComputer(final String userPoolId) {
    this(SrpGroup.RFC5054_3072, userPoolId);
  }

  /**
   * Instantiates a new Proof computer.
   *
   * @param group      the group
   * @param userPoolId the user pool id
   */
  public ProofComputer(final SrpGroup group, final String userPoolId) {
    this.group = group;
    this.poolName = poolName(userPoolId);
  }

  /**
   * The segment of a user pool id after its first underscore, or the whole id when there is none.
   *
   * @param userPoolId the user pool id
   * @return the pool name
   */
  public static String poolName(String userPoolId) {
    if (userPoolId == null || userPoolId.isBlank()) {
      throw new IllegalArgumentException("User pool id must not be empty");
    }
    int separator = userPoolId.indexOf('_');
    return separator < 0 ? userPoolId : userPoolId.substring(separator + 1);
  }

  /**
   * Computes the password claim for one challenge.
   *
   * @param keyPair   the ephemeral key pair of this attempt
   * @param challenge the challenge parameters
   * @param password  the plaintext password
   * @param timestamp the timestamp text, signed and echoed unchanged
   * @return the password claim
   * @throws SrpProtocolException if {@code B mod N} or {@code u} is zero
   */
  public PasswordClaim computeClaim(SrpKeyPair keyPair,
                                    ChallengeContext challenge,
                                    String password,
                                    String timestamp) {
    byte[] key = deriveKey(keyPair, challenge, password);
    byte[] secretBlock = decodeSecretBlock(challenge.secretBlock());
    byte[] message = concat(
        poolName.getBytes(StandardCharsets.UTF_8),
        challenge.usernameForSrp().getBytes(StandardCharsets.UTF_8),
        secretBlock,
        timestamp.getBytes(StandardCharsets.UTF_8));
    String signature = B64.encodeToString(SrpCrypto.hmacSha256(key, message));
    return new PasswordClaim(signature, timestamp, challenge.usernameForSrp(), challenge.secretBlock());
  }

  /**
   * Derives the 16-byte signing key shared with the server.
   *
   * @param keyPair   the key pair
   * @param challenge the challenge
   * @param password  the password
   * @return the derived key
   */
  public byte[] deriveKey(SrpKeyPair keyPair, ChallengeContext challenge, String password) {
    BigInteger n = group.n();
    BigInteger largeB = ByteUtils.fromHex(challenge.serverPublicKeyHex());
    if (largeB.mod(n).signum() == 0) {
      throw new SrpProtocolException("Server public value B is zero mod N");
    }
    BigInteger u = computeU(keyPair.publicKey(), largeB);
    if (u.signum() == 0) {
      throw new SrpProtocolException("SRP scrambling parameter u is zero");
    }
    BigInteger x = computeX(challenge.saltHex(), challenge.usernameForSrp(), password);
    BigInteger gx = SrpCrypto.modPow(group.g(), x, n);
    BigInteger base = largeB.subtract(group.k().multiply(gx)).mod(n);
    BigInteger exponent = keyPair.privateKey().add(u.multiply(x));
    BigInteger sharedSecret = SrpCrypto.modPow(base, exponent, n);

    byte[] prk = SrpCrypto.hkdfExtract(paddedBytes(u), paddedBytes(sharedSecret));
    return SrpCrypto.hkdfExpand(prk, DERIVED_KEY_INFO, DERIVED_KEY_LENGTH);
  }

  /**
   * u = H(PAD(A) || PAD(B)).
   *
   * @param largeA the client public value
   * @param largeB the server public value
   * @return u
   */
  protected BigInteger computeU(BigInteger largeA, BigInteger largeB) {
    return SrpCrypto.hashToInteger(paddedBytes(largeA), paddedBytes(largeB));
  }

  /**
   * x = H(PAD(salt) || H(poolName || username || ":" || password)).
   *
   * @param saltHex  the salt
   * @param username the username for srp
   * @param password the password
   * @return x
   */
  protected BigInteger computeX(String saltHex, String username, String password) {
    byte[] identityHash = SrpCrypto.sha256(
        (poolName + username + ":" + password).getBytes(StandardCharsets.UTF_8));
    return SrpCrypto.hashToInteger(paddedBytes(saltHex), identityHash);
  }

  /**
   * The pool name that enters {@code x} and the signature.
   *
   * @return the pool name
   */
  public String poolName() {
    return poolName;
  }

  private static byte[] decodeSecretBlock(String secretBlock) {
    try {
      return B64D.decode(secretBlock);
    } catch (IllegalArgumentException e) {
      throw new SrpProtocolException("Invalid base64 in SECRET_BLOCK", e);
    }
  }
}
