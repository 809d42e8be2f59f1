package com.codeheadsystems.geni.srp.common;

import java.math.BigInteger;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * Utility methods for hex strings and byte arrays as they appear on the SRP wire.
 * <p>
 * Cognito exchanges every big integer as an unsigned hex string. Hashes are taken over the
 * bytes of the <em>padded</em> hex form, so {@link #padHex(String)} must be applied before any
 * value is fed to a digest.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Pads a hex string so it decodes to a byte array a signed big-integer parser reads as positive.
   * <p>
   * An odd-length string gains a single leading {@code 0}. An even-length string whose first
   * byte is {@code 0x80} or above gains a leading {@code 00} byte.
   *
   * @param hex the hex string
   * @return the padded hex string, always of even length
   * @throws IllegalArgumentException if the input is null, empty, or not hex
   */
  public static String padHex(String hex) {
    requireHex(hex);
    if (hex.length() % 2 == 1) {
      return "0" + hex;
    }
    if (Integer.parseInt(hex.substring(0, 2), 16) >= 0x80) {
      return "00" + hex;
    }
    return hex;
  }

  /**
   * Lower-case unsigned hex of a non-negative integer, without padding.
   *
   * @param value the value
   * @return the hex string
   */
  public static String toHex(BigInteger value) {
    if (value.signum() < 0) {
      throw new IllegalArgumentException("Negative values have no wire encoding");
    }
    return value.toString(16);
  }

  /**
   * Parses an unsigned hex string.
   *
   * @param hex the hex string
   * @return the big integer
   */
  public static BigInteger fromHex(String hex) {
    requireHex(hex);
    return new BigInteger(hex, 16);
  }

  /**
   * Decodes a hex string to bytes after applying {@link #padHex(String)}.
   *
   * @param hex the hex string
   * @return the decoded bytes
   */
  public static byte[] paddedBytes(String hex) {
    try {
      return Hex.decode(padHex(hex));
    } catch (DecoderException e) {
      throw new IllegalArgumentException("Invalid hex string", e);
    }
  }

  /**
   * Bytes of the padded hex encoding of a big integer.
   *
   * @param value the value
   * @return the decoded bytes
   */
  public static byte[] paddedBytes(BigInteger value) {
    return paddedBytes(toHex(value));
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  private static void requireHex(String hex) {
    if (hex == null || hex.isEmpty()) {
      throw new IllegalArgumentException("Hex string must not be empty");
    }
    for (int i = 0; i < hex.length(); i++) {
      if (Character.digit(hex.charAt(i), 16) < 0) {
        throw new IllegalArgumentException("Invalid hex character at index " + i);
      }
    }
  }
}
