package com.codeheadsystems.geni.srp.model;

import com.codeheadsystems.geni.srp.common.ByteUtils;
import java.math.BigInteger;

/**
 * Ephemeral client key pair for one login attempt: private exponent {@code a} and public value
 * {@code A = g^a mod N}.
 * <p>
 * Instances must never be serialized or kept beyond the attempt that created them.
 * {@link #toString()} omits the private exponent.
 *
 * @param privateKey the private exponent a
 * @param publicKey  the public value A
 */
public record SrpKeyPair(BigInteger privateKey, BigInteger publicKey) {

  /**
   * The public value as the unpadded hex string sent in {@code SRP_A}.
   *
   * @return the hex string
   */
  public String publicKeyHex() {
    return ByteUtils.toHex(publicKey);
  }

  @Override
  public String toString() {
    return "SrpKeyPair[publicKey=" + publicKeyHex() + "]";
  }
}
