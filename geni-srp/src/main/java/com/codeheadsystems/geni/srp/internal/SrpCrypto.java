package com.codeheadsystems.geni.srp.internal;

import static com.codeheadsystems.geni.srp.common.ByteUtils.concat;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Low-level cryptographic primitives for the SRP exchange. All hashing is SHA-256.
 */
public class SrpCrypto {

  /**
   * SHA-256 output length in bytes.
   */
  public static final int HASH_LENGTH = 32;

  private static final String HASH_ALGORITHM = "SHA-256";
  private static final String HMAC_ALGORITHM = "HmacSHA256";

  private SrpCrypto() {
  }

  /**
   * H(input_1 || ... || input_n).
   */
  public static byte[] sha256(byte[]... inputs) {
    try {
      MessageDigest md = MessageDigest.getInstance(HASH_ALGORITHM);
      for (byte[] input : inputs) {
        md.update(input);
      }
      return md.digest();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(HASH_ALGORITHM + " not available", e);
    }
  }

  /**
   * H(inputs) read as an unsigned integer.
   */
  public static BigInteger hashToInteger(byte[]... inputs) {
    return new BigInteger(1, sha256(inputs));
  }

  /**
   * HMAC-SHA256(key, data).
   */
  public static byte[] hmacSha256(byte[] key, byte[] data) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(HMAC_ALGORITHM + " not available", e);
    }
  }

  /**
   * HKDF-Extract(salt, ikm) = HMAC(salt, ikm), RFC 5869 §2.2.
   */
  public static byte[] hkdfExtract(byte[] salt, byte[] ikm) {
    byte[] actualSalt = (salt == null || salt.length == 0) ? new byte[HASH_LENGTH] : salt;
    return hmacSha256(actualSalt, ikm);
  }

  /**
   * HKDF-Expand(prk, info, len) per RFC 5869 §2.3.
   */
  public static byte[] hkdfExpand(byte[] prk, byte[] info, int len) {
    if (len > 255 * HASH_LENGTH) {
      throw new IllegalArgumentException("HKDF output too long: " + len);
    }
    byte[] result = new byte[len];
    byte[] t = new byte[0];
    int copied = 0;
    int counter = 1;
    while (copied < len) {
      t = hmacSha256(prk, concat(t, info, new byte[]{(byte) counter}));
      int toCopy = Math.min(len - copied, HASH_LENGTH);
      System.arraycopy(t, 0, result, copied, toCopy);
      copied += toCopy;
      counter++;
    }
    return result;
  }

  /**
   * base^exponent mod modulus.
   */
  public static BigInteger modPow(BigInteger base, BigInteger exponent, BigInteger modulus) {
    return base.modPow(exponent, modulus);
  }
}
