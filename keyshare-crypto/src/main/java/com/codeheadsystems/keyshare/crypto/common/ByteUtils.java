package com.codeheadsystems.keyshare.crypto.common;

import java.math.BigInteger;
import java.security.MessageDigest;

/**
 * Utility methods for the little-endian octet encodings used by ristretto255, Merlin and SS58.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Encodes a non-negative int as a 4-byte little-endian array, the length prefix Merlin
   * absorbs ahead of every message.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] le32(int value) {
    if (value < 0) {
      throw new IllegalArgumentException("Value must be non-negative: " + value);
    }
    return new byte[]{
        (byte) value,
        (byte) (value >>> 8),
        (byte) (value >>> 16),
        (byte) (value >>> 24)
    };
  }

  /**
   * Decodes a little-endian byte array to a non-negative BigInteger.
   *
   * @param b the bytes
   * @return the big integer
   */
  public static BigInteger decodeLittleEndian(byte[] b) {
    byte[] rev = new byte[b.length];
    for (int i = 0; i < b.length; i++) {
      rev[i] = b[b.length - 1 - i];
    }
    return new BigInteger(1, rev);
  }

  /**
   * Encodes a non-negative BigInteger as a {@code length}-byte little-endian array.
   *
   * @param k      the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] encodeLittleEndian(BigInteger k, int length) {
    if (k.signum() < 0 || k.bitLength() > 8 * length) {
      throw new IllegalArgumentException("Value does not fit in " + length + " bytes");
    }
    byte[] be = k.toByteArray();
    byte[] result = new byte[length];
    int copyLen = Math.min(be.length, length);
    for (int i = 0; i < copyLen; i++) {
      result[i] = be[be.length - 1 - i];
    }
    return result;
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

  /**
   * Constant-time comparison of two byte arrays.
   *
   * @param a the a
   * @param b the b
   * @return true if both arrays hold the same bytes
   */
  public static boolean constantTimeEquals(byte[] a, byte[] b) {
    return MessageDigest.isEqual(a, b);
  }
}
