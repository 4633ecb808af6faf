package com.codeheadsystems.keyshare.crypto.ristretto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.security.SecureRandom;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

/**
 * Group properties and RFC 9496 vectors for {@link Ristretto255Group}.
 */
class Ristretto255GroupTest {

  private static final Ristretto255Group GROUP = Ristretto255Group.INSTANCE;

  // RFC 9496 Appendix A.1, multiples of the generator
  private static final String IDENTITY_HEX =
      "0000000000000000000000000000000000000000000000000000000000000000";
  private static final String GENERATOR_HEX =
      "e2f2ae0a6abc4e71a884a961c500515f58e30b6aa582dd8db6a65945e08d2d76";
  private static final String TWO_B_HEX =
      "6a493210f7499cd17fecb510ae0cea23a110e8d5b901f8acadd3095c73a3b919";

  // ─── Generator multiples ──────────────────────────────────────────────────

  @Test
  void basePoint_satisfiesCurveEquation() {
    BigInteger p = Ristretto255Group.P;
    BigInteger x2 = Ristretto255Group.BX.multiply(Ristretto255Group.BX).mod(p);
    BigInteger y2 = Ristretto255Group.BY.multiply(Ristretto255Group.BY).mod(p);
    // -x^2 + y^2 = 1 + d x^2 y^2
    BigInteger lhs = y2.subtract(x2).mod(p);
    BigInteger rhs = BigInteger.ONE.add(Ristretto255Group.D.multiply(x2).multiply(y2)).mod(p);
    assertThat(lhs).isEqualTo(rhs);
    assertThat(Ristretto255Group.BX.testBit(0)).isFalse();
  }

  @Test
  void scalarMultiplyGenerator_knownMultiples() {
    assertThat(Hex.toHexString(GROUP.scalarMultiplyGenerator(BigInteger.ZERO))).isEqualTo(IDENTITY_HEX);
    assertThat(Hex.toHexString(GROUP.scalarMultiplyGenerator(BigInteger.ONE))).isEqualTo(GENERATOR_HEX);
    assertThat(Hex.toHexString(GROUP.scalarMultiplyGenerator(BigInteger.TWO))).isEqualTo(TWO_B_HEX);
  }

  @Test
  void scalarMultiplyGenerator_groupOrder_isIdentity() {
    assertThat(Hex.toHexString(GROUP.scalarMultiplyGenerator(GROUP.groupOrder())))
        .isEqualTo(IDENTITY_HEX);
  }

  @Test
  void scalarMultiply_matchesGeneratorMultiplication() {
    byte[] generator = Hex.decode(GENERATOR_HEX);
    BigInteger k = BigInteger.valueOf(1234567);
    assertThat(GROUP.scalarMultiply(k, generator)).isEqualTo(GROUP.scalarMultiplyGenerator(k));
  }

  // ─── Verification combination ─────────────────────────────────────────────

  @Test
  void generatorMinusElement_cancelsWhenScalarsMatch() {
    // b*B - a*(cB) with b = a*c is the identity
    SecureRandom random = new SecureRandom();
    BigInteger c = GROUP.randomScalar(random);
    BigInteger a = GROUP.randomScalar(random);
    byte[] element = GROUP.scalarMultiplyGenerator(c);
    BigInteger b = a.multiply(c).mod(GROUP.groupOrder());

    assertThat(Hex.toHexString(GROUP.generatorMinusElement(b, a, element))).isEqualTo(IDENTITY_HEX);
  }

  @Test
  void generatorMinusElement_matchesDirectComputation() {
    // 5*B - 2*(3B) = -B
    byte[] threeB = GROUP.scalarMultiplyGenerator(BigInteger.valueOf(3));
    byte[] result = GROUP.generatorMinusElement(BigInteger.valueOf(5), BigInteger.TWO, threeB);
    assertThat(result).isEqualTo(GROUP.scalarMultiplyGenerator(GROUP.groupOrder().subtract(BigInteger.ONE)));
  }

  // ─── Decoding ─────────────────────────────────────────────────────────────

  @Test
  void isValidElement_acceptsCanonicalEncodings() {
    assertThat(GROUP.isValidElement(Hex.decode(GENERATOR_HEX))).isTrue();
    assertThat(GROUP.isValidElement(Hex.decode(TWO_B_HEX))).isTrue();
    assertThat(GROUP.isValidElement(Hex.decode(IDENTITY_HEX))).isTrue();
  }

  @Test
  void isValidElement_rejectsNegativeFieldElement() {
    // s = 1 is odd, so "negative"
    byte[] one = new byte[32];
    one[0] = 1;
    assertThat(GROUP.isValidElement(one)).isFalse();
  }

  @Test
  void isValidElement_rejectsNonCanonicalFieldElement() {
    // s = p
    byte[] p = Hex.decode("edffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff7f");
    assertThat(GROUP.isValidElement(p)).isFalse();
  }

  @Test
  void isValidElement_rejectsWrongLengthAndNull() {
    assertThat(GROUP.isValidElement(new byte[31])).isFalse();
    assertThat(GROUP.isValidElement(null)).isFalse();
  }

  @Test
  void scalarMultiply_invalidElement_throwsSecurityException() {
    byte[] one = new byte[32];
    one[0] = 1;
    assertThatThrownBy(() -> GROUP.scalarMultiply(BigInteger.ONE, one))
        .isInstanceOf(SecurityException.class);
  }

  // ─── Scalars ──────────────────────────────────────────────────────────────

  @Test
  void reduceWide_reducesModOrder() {
    byte[] wide = new byte[64];
    byte[] order = GROUP.serializeScalar(GROUP.groupOrder().subtract(BigInteger.ONE));
    System.arraycopy(order, 0, wide, 0, 32);
    wide[0] += 1; // exactly L
    assertThat(GROUP.reduceWide(wide)).isEqualTo(BigInteger.ZERO);
  }

  @Test
  void reduceWide_rejectsWrongLength() {
    assertThatThrownBy(() -> GROUP.reduceWide(new byte[32]))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void randomScalar_isInRange() {
    SecureRandom random = new SecureRandom();
    for (int i = 0; i < 20; i++) {
      BigInteger k = GROUP.randomScalar(random);
      assertThat(k).isPositive().isLessThan(GROUP.groupOrder());
    }
  }
}
