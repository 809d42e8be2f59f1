package com.codeheadsystems.geni.srp;

import com.codeheadsystems.geni.srp.common.RandomProvider;
import com.codeheadsystems.geni.srp.config.SrpGroup;
import com.codeheadsystems.geni.srp.internal.SrpCrypto;
import com.codeheadsystems.geni.srp.model.SrpKeyPair;
import java.math.BigInteger;

/**
 * Generates the client's ephemeral SRP key pair. A new pair is drawn for every login attempt;
 * pairs are never reused across attempts.
 */
public class SrpKeyExchange {

  /**
   * Number of random bytes drawn for the private exponent before reduction mod N.
   */
  public static final int EPHEMERAL_KEY_BYTES = 128;

  private final SrpGroup group;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Srp key exchange over the Cognito group.
   */
  public SrpKeyExchange() {
    this(SrpGroup.RFC5054_3072, new RandomProvider());
  }

  /**
   * Instantiates a new Srp key exchange.
   *
   * @param group          the group
   * @param randomProvider the random provider
   */
  public SrpKeyExchange(final SrpGroup group, final RandomProvider randomProvider) {
    this.group = group;
    this.randomProvider = randomProvider;
  }

  /**
   * Draws {@code a} and computes {@code A = g^a mod N}.
   *
   * @return the srp key pair
   */
  public SrpKeyPair generate() {
    BigInteger a = new BigInteger(1, randomProvider.randomBytes(EPHEMERAL_KEY_BYTES)).mod(group.n());
    BigInteger largeA = SrpCrypto.modPow(group.g(), a, group.n());
    return new SrpKeyPair(a, largeA);
  }

  /**
   * The group this exchange works in.
   *
   * @return the srp group
   */
  public SrpGroup group() {
    return group;
  }
}
