package com.codeheadsystems.keyshare.crypto.ristretto;

import static com.codeheadsystems.keyshare.crypto.common.ByteUtils.decodeLittleEndian;
import static com.codeheadsystems.keyshare.crypto.common.ByteUtils.encodeLittleEndian;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * The ristretto255 prime-order group (RFC 9496), the group behind sr25519 account keys.
 * <p>
 * Points are carried internally as Edwards25519 extended coordinates (X, Y, Z, T) and cross
 * the public API only in their canonical 32-byte encoding. Scalars are little-endian mod L.
 * <p>
 * All arithmetic is variable time. That is acceptable here because the group is only used to
 * verify signatures over public data; the signing helpers exist for clients and tests.
 */
public final class Ristretto255Group {

  /** Singleton instance. */
  public static final Ristretto255Group INSTANCE = new Ristretto255Group();

  /** Size in bytes of an encoded element or scalar. */
  public static final int ELEMENT_SIZE = 32;

  // ─── Field modulus and group order ──────────────────────────────────────────

  /** p = 2^255 - 19 */
  static final BigInteger P = BigInteger.TWO.pow(255).subtract(BigInteger.valueOf(19));

  /** L = 2^252 + 27742317777372353535851937790883648493 */
  static final BigInteger L = BigInteger.TWO.pow(252).add(
      new BigInteger("27742317777372353535851937790883648493"));

  // ─── RFC 9496 §4.1 constants ─────────────────────────────────────────────

  /** d = -121665/121666 mod p */
  static final BigInteger D = new BigInteger(
      "37095705934669439343138083508754565189542113879843219016388785533085940283555");

  /** sqrt(-1) = 2^((p-1)/4) mod p */
  static final BigInteger SQRT_M1 = new BigInteger(
      "19681161376707505956807079304988542015446066515923890162744021073123829784752");

  /** 1/sqrt(a - d), even root */
  static final BigInteger INVSQRT_A_MINUS_D = new BigInteger(
      "54469307008909316920995813868745141605393597292927456921205312896311721017578");

  private static final BigInteger TWO_D = BigInteger.TWO.multiply(D).mod(P);

  private static final BigInteger SQRT_EXPONENT =
      P.subtract(BigInteger.valueOf(5)).divide(BigInteger.valueOf(8));

  // ─── Edwards25519 base point ─────────────────────────────────────────────

  static final BigInteger BX = new BigInteger(
      "15112221349535400772501151409588531511454012693041857206046113283949847762202");

  // By = 4/5 mod p
  static final BigInteger BY = BigInteger.valueOf(4)
      .multiply(BigInteger.valueOf(5).modInverse(P)).mod(P);

  private static final BigInteger[] BASE_POINT =
      new BigInteger[]{BX, BY, BigInteger.ONE, fmul(BX, BY)};

  private Ristretto255Group() {
  }

  // ─── Public group operations ─────────────────────────────────────────────

  /**
   * The group order L.
   *
   * @return L
   */
  public BigInteger groupOrder() {
    return L;
  }

  /**
   * Computes k*B for the ristretto255 generator B.
   *
   * @param scalar the scalar, reduced mod L
   * @return the encoded element
   */
  public byte[] scalarMultiplyGenerator(BigInteger scalar) {
    return encodeRistretto255(scalarMul(BASE_POINT, scalar));
  }

  /**
   * Computes k*A for an encoded element A.
   *
   * @param scalar  the scalar, reduced mod L
   * @param element the encoded element
   * @return the encoded product
   * @throws SecurityException if the element is not a canonical encoding
   */
  public byte[] scalarMultiply(BigInteger scalar, byte[] element) {
    return encodeRistretto255(scalarMul(decodeRistretto255(element), scalar));
  }

  /**
   * Computes {@code b*B - a*A}, the Schnorr verification combination, where B is the generator.
   *
   * @param a       scalar applied to the negated element
   * @param element the encoded element A
   * @param b       scalar applied to the generator
   * @return the encoded result
   * @throws SecurityException if the element is not a canonical encoding
   */
  public byte[] generatorMinusElement(BigInteger b, BigInteger a, byte[] element) {
    BigInteger[] negA = negate(decodeRistretto255(element));
    return encodeRistretto255(addPoints(scalarMul(BASE_POINT, b), scalarMul(negA, a)));
  }

  /**
   * Whether the bytes are a canonical encoding of a group element.
   *
   * @param element the bytes
   * @return true when decodable
   */
  public boolean isValidElement(byte[] element) {
    if (element == null || element.length != ELEMENT_SIZE) {
      return false;
    }
    try {
      decodeRistretto255(element);
      return true;
    } catch (SecurityException e) {
      return false;
    }
  }

  /**
   * Reduces a 64-byte little-endian value mod L, as curve25519 {@code from_bytes_mod_order_wide}.
   *
   * @param wide the 64 bytes
   * @return the scalar
   */
  public BigInteger reduceWide(byte[] wide) {
    if (wide.length != 64) {
      throw new IllegalArgumentException("Wide scalar input must be 64 bytes");
    }
    return decodeLittleEndian(wide).mod(L);
  }

  /**
   * Draws a uniformly random non-zero scalar.
   *
   * @param random the randomness source
   * @return the scalar
   */
  public BigInteger randomScalar(SecureRandom random) {
    BigInteger k;
    do {
      k = new BigInteger(L.bitLength(), random);
    } while (k.signum() == 0 || k.compareTo(L) >= 0);
    return k;
  }

  /**
   * Serializes a scalar as 32-byte little-endian.
   *
   * @param k the scalar
   * @return the bytes
   */
  public byte[] serializeScalar(BigInteger k) {
    return encodeLittleEndian(k.mod(L), ELEMENT_SIZE);
  }

  // ─── Field arithmetic (GF(p)) ────────────────────────────────────────────

  static BigInteger fmul(BigInteger a, BigInteger b) {
    return a.multiply(b).mod(P);
  }

  static BigInteger fadd(BigInteger a, BigInteger b) {
    return a.add(b).mod(P);
  }

  static BigInteger fsub(BigInteger a, BigInteger b) {
    return a.subtract(b).mod(P);
  }

  static BigInteger fneg(BigInteger a) {
    BigInteger r = a.mod(P);
    return r.signum() == 0 ? BigInteger.ZERO : P.subtract(r);
  }

  static BigInteger fsq(BigInteger a) {
    return a.multiply(a).mod(P);
  }

  /** IS_NEGATIVE: true if the canonical representative is odd. */
  static boolean isNegative(BigInteger u) {
    return u.mod(P).testBit(0);
  }

  /** CT_ABS: negate u if IS_NEGATIVE(u). */
  static BigInteger abs(BigInteger u) {
    BigInteger r = u.mod(P);
    return isNegative(r) ? P.subtract(r) : r;
  }

  // ─── SQRT_RATIO_M1 (RFC 9496 §4.2) ──────────────────────────────────────

  /**
   * Returns [1 if u/v is square else 0, CT_ABS(sqrt(u/v)) or CT_ABS(sqrt(i*u/v))].
   */
  static BigInteger[] sqrtRatioM1(BigInteger u, BigInteger v) {
    BigInteger v3 = fmul(fsq(v), v);
    BigInteger v7 = fmul(fsq(v3), v);
    BigInteger r = fmul(fmul(u, v3), fmul(u, v7).modPow(SQRT_EXPONENT, P));

    BigInteger check = fmul(v, fsq(r));
    boolean correctSign = check.equals(u.mod(P));
    boolean flippedSign = check.equals(fneg(u));
    boolean flippedSignI = check.equals(fneg(fmul(u, SQRT_M1)));

    if (flippedSign || flippedSignI) {
      r = fmul(SQRT_M1, r);
    }
    r = abs(r);
    return new BigInteger[]{correctSign || flippedSign ? BigInteger.ONE : BigInteger.ZERO, r};
  }

  // ─── Decode (RFC 9496 §4.3.1) ────────────────────────────────────────────

  /**
   * Decodes a canonical 32-byte encoding to extended coordinates.
   *
   * @throws SecurityException if the encoding is invalid
   */
  static BigInteger[] decodeRistretto255(byte[] s) {
    if (s.length != ELEMENT_SIZE) {
      throw new SecurityException("ristretto255 encoding must be 32 bytes, got " + s.length);
    }
    BigInteger sInt = decodeLittleEndian(s);
    if (sInt.compareTo(P) >= 0) {
      throw new SecurityException("Invalid ristretto255 encoding: s >= p");
    }
    if (isNegative(sInt)) {
      throw new SecurityException("Invalid ristretto255 encoding: s is negative");
    }

    BigInteger ss = fsq(sInt);
    BigInteger u1 = fsub(BigInteger.ONE, ss);
    BigInteger u2 = fadd(BigInteger.ONE, ss);
    BigInteger u2Sq = fsq(u2);
    BigInteger v = fsub(fneg(fmul(D, fsq(u1))), u2Sq);

    BigInteger[] sr = sqrtRatioM1(BigInteger.ONE, fmul(v, u2Sq));
    if (sr[0].signum() == 0) {
      throw new SecurityException("Invalid ristretto255 encoding: not a quadratic residue");
    }
    BigInteger invsqrt = sr[1];

    BigInteger denX = fmul(invsqrt, u2);
    BigInteger denY = fmul(fmul(invsqrt, denX), v);
    BigInteger x = abs(fmul(fmul(BigInteger.TWO, sInt), denX));
    BigInteger y = fmul(u1, denY);
    BigInteger t = fmul(x, y);

    if (isNegative(t) || y.signum() == 0) {
      throw new SecurityException("Invalid ristretto255 encoding: rejected by final checks");
    }
    return new BigInteger[]{x, y, BigInteger.ONE, t};
  }

  // ─── Encode (RFC 9496 §4.3.2) ────────────────────────────────────────────

  static byte[] encodeRistretto255(BigInteger[] point) {
    BigInteger x0 = point[0].mod(P);
    BigInteger y0 = point[1].mod(P);
    BigInteger z0 = point[2].mod(P);
    BigInteger t0 = point[3].mod(P);

    BigInteger u1 = fmul(fadd(z0, y0), fsub(z0, y0));
    BigInteger u2 = fmul(x0, y0);

    BigInteger invsqrt = sqrtRatioM1(BigInteger.ONE, fmul(u1, fsq(u2)))[1];

    BigInteger den1 = fmul(invsqrt, u1);
    BigInteger den2 = fmul(invsqrt, u2);
    BigInteger zInv = fmul(fmul(den1, den2), t0);

    BigInteger ix0 = fmul(x0, SQRT_M1);
    BigInteger iy0 = fmul(y0, SQRT_M1);
    BigInteger enchantedDen = fmul(den1, INVSQRT_A_MINUS_D);

    boolean rotate = isNegative(fmul(t0, zInv));
    BigInteger x = rotate ? iy0 : x0;
    BigInteger y = rotate ? ix0 : y0;
    BigInteger denInv = rotate ? enchantedDen : den2;

    if (isNegative(fmul(x, zInv))) {
      y = fneg(y);
    }

    BigInteger s = abs(fmul(denInv, fsub(z0, y)));
    return encodeLittleEndian(s, ELEMENT_SIZE);
  }

  // ─── Edwards25519 extended-coordinate arithmetic ─────────────────────────

  /** Unified addition, RFC 8032 §5.1.4 with k = 2*d. */
  static BigInteger[] addPoints(BigInteger[] p1, BigInteger[] p2) {
    BigInteger a = fmul(fsub(p1[1], p1[0]), fsub(p2[1], p2[0]));
    BigInteger b = fmul(fadd(p1[1], p1[0]), fadd(p2[1], p2[0]));
    BigInteger c = fmul(fmul(p1[3], TWO_D), p2[3]);
    BigInteger dd = fmul(fmul(BigInteger.TWO, p1[2]), p2[2]);
    BigInteger e = fsub(b, a);
    BigInteger f = fsub(dd, c);
    BigInteger g = fadd(dd, c);
    BigInteger h = fadd(b, a);
    return new BigInteger[]{fmul(e, f), fmul(g, h), fmul(f, g), fmul(e, h)};
  }

  /** dbl-2008-hwcd for a = -1. */
  static BigInteger[] doublePoint(BigInteger[] pt) {
    BigInteger a = fsq(pt[0]);
    BigInteger b = fsq(pt[1]);
    BigInteger c = fmul(BigInteger.TWO, fsq(pt[2]));
    BigInteger negA = fneg(a);
    BigInteger e = fsub(fsub(fsq(fadd(pt[0], pt[1])), a), b);
    BigInteger g = fadd(negA, b);
    BigInteger f = fsub(g, c);
    BigInteger h = fsub(negA, b);
    return new BigInteger[]{fmul(e, f), fmul(g, h), fmul(f, g), fmul(e, h)};
  }

  /** -(X, Y, Z, T) = (-X, Y, Z, -T). */
  static BigInteger[] negate(BigInteger[] pt) {
    return new BigInteger[]{fneg(pt[0]), pt[1], pt[2], fneg(pt[3])};
  }

  static BigInteger[] neutralElement() {
    return new BigInteger[]{BigInteger.ZERO, BigInteger.ONE, BigInteger.ONE, BigInteger.ZERO};
  }

  /** Right-to-left double-and-add; k is reduced mod L first. */
  static BigInteger[] scalarMul(BigInteger[] pt, BigInteger k) {
    k = k.mod(L);
    BigInteger[] result = neutralElement();
    BigInteger[] addend = pt;
    for (int i = 0; i < k.bitLength(); i++) {
      if (k.testBit(i)) {
        result = addPoints(result, addend);
      }
      addend = doublePoint(addend);
    }
    return result;
  }
}
