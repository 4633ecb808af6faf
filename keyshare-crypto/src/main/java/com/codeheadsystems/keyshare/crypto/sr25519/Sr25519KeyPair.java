package com.codeheadsystems.keyshare.crypto.sr25519;

import com.codeheadsystems.keyshare.crypto.ristretto.Ristretto255Group;
import java.math.BigInteger;
import java.security.SecureRandom;
import org.bouncycastle.util.encoders.Hex;

/**
 * An sr25519 secret scalar with its encoded public key. Used by request-building clients and
 * by tests; the gate itself only verifies.
 *
 * @param secretScalar the secret scalar in [1, L)
 * @param publicKey    the 32-byte encoding of secretScalar * B
 */
public record Sr25519KeyPair(BigInteger secretScalar, byte[] publicKey) {

  /**
   * Derives the key pair for a secret scalar.
   *
   * @param secretScalar the secret
   * @return the key pair
   */
  public static Sr25519KeyPair fromSecretScalar(BigInteger secretScalar) {
    Ristretto255Group group = Ristretto255Group.INSTANCE;
    BigInteger reduced = secretScalar.mod(group.groupOrder());
    if (reduced.signum() == 0) {
      throw new IllegalArgumentException("Secret scalar must be non-zero mod L");
    }
    return new Sr25519KeyPair(reduced, group.scalarMultiplyGenerator(reduced));
  }

  /**
   * Generates a fresh key pair.
   *
   * @param random the randomness source
   * @return the key pair
   */
  public static Sr25519KeyPair generate(SecureRandom random) {
    return fromSecretScalar(Ristretto255Group.INSTANCE.randomScalar(random));
  }

  @Override
  public byte[] publicKey() {
    return publicKey.clone();
  }

  @Override
  public String toString() {
    return "Sr25519KeyPair[publicKey=" + Hex.toHexString(publicKey) + "]";
  }
}
