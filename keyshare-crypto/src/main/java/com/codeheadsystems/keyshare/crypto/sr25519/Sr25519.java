package com.codeheadsystems.keyshare.crypto.sr25519;

import com.codeheadsystems.keyshare.crypto.common.ByteUtils;
import com.codeheadsystems.keyshare.crypto.merlin.MerlinTranscript;
import com.codeheadsystems.keyshare.crypto.ristretto.Ristretto255Group;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schnorrkel signatures over ristretto255 as used by Substrate accounts (sr25519).
 * <p>
 * A signature is {@code R || s} with the high bit of the last byte set as the Schnorrkel
 * marker. The challenge is squeezed from a Merlin transcript seeded with the signing
 * context, the message, the public key and R.
 * <p>
 * {@link #verify(byte[], byte[], byte[])} never throws on 64-byte input: every malformed
 * component yields {@code false}.
 */
public final class Sr25519 {

  /** Signing context Substrate uses for account signatures. */
  public static final String SUBSTRATE_CONTEXT = "substrate";

  public static final int SIGNATURE_LENGTH = 64;
  public static final int PUBLIC_KEY_LENGTH = 32;

  private static final Logger log = LoggerFactory.getLogger(Sr25519.class);
  private static final Ristretto255Group GROUP = Ristretto255Group.INSTANCE;

  private final String context;
  private final SecureRandom random;

  /**
   * Instantiates a verifier/signer bound to a signing context.
   *
   * @param context the signing context
   * @param random  randomness for signing nonces
   */
  public Sr25519(String context, SecureRandom random) {
    this.context = context;
    this.random = random;
  }

  /**
   * A verifier/signer for the Substrate signing context.
   *
   * @return the instance
   */
  public static Sr25519 substrate() {
    return new Sr25519(SUBSTRATE_CONTEXT, new SecureRandom());
  }

  /**
   * Verifies a signature over the message against the public key.
   *
   * @param signature the 64 signature bytes
   * @param message   the signed bytes
   * @param publicKey the 32-byte ristretto255 public key
   * @return true only when the signature is valid
   */
  public boolean verify(byte[] signature, byte[] message, byte[] publicKey) {
    if (signature == null || signature.length != SIGNATURE_LENGTH
        || publicKey == null || publicKey.length != PUBLIC_KEY_LENGTH) {
      return false;
    }
    if ((signature[63] & 0x80) == 0) {
      log.trace("verify: signature lacks the schnorrkel marker bit");
      return false;
    }
    byte[] r = Arrays.copyOfRange(signature, 0, 32);
    byte[] sBytes = Arrays.copyOfRange(signature, 32, 64);
    sBytes[31] &= 0x7F;
    BigInteger s = ByteUtils.decodeLittleEndian(sBytes);
    // Scalars with the top four bits clear are accepted unreduced; anything above must be canonical.
    if ((sBytes[31] & 0xF0) != 0 && s.compareTo(GROUP.groupOrder()) >= 0) {
      log.trace("verify: non-canonical signature scalar");
      return false;
    }
    if (!GROUP.isValidElement(publicKey)) {
      log.trace("verify: public key is not a ristretto255 element");
      return false;
    }

    BigInteger k = challenge(message, publicKey, r);
    byte[] expectedR = GROUP.generatorMinusElement(s, k, publicKey);
    return ByteUtils.constantTimeEquals(expectedR, r);
  }

  /**
   * Signs the message with a random nonce.
   *
   * @param keyPair the signing key
   * @param message the bytes to sign
   * @return the 64 signature bytes with the marker bit set
   */
  public byte[] sign(Sr25519KeyPair keyPair, byte[] message) {
    BigInteger nonce = GROUP.randomScalar(random);
    byte[] r = GROUP.scalarMultiplyGenerator(nonce);
    BigInteger k = challenge(message, keyPair.publicKey(), r);
    BigInteger s = k.multiply(keyPair.secretScalar()).add(nonce).mod(GROUP.groupOrder());
    byte[] signature = ByteUtils.concat(r, GROUP.serializeScalar(s));
    signature[63] |= (byte) 0x80;
    return signature;
  }

  @Override
  public String toString() {
    return "Sr25519[context=" + context + "]";
  }

  private BigInteger challenge(byte[] message, byte[] publicKey, byte[] r) {
    MerlinTranscript transcript = MerlinTranscript.create("SigningContext")
        .appendMessage("", context.getBytes(StandardCharsets.UTF_8))
        .appendMessage("sign-bytes", message)
        .appendMessage("proto-name", "Schnorr-sig".getBytes(StandardCharsets.US_ASCII))
        .appendMessage("sign:pk", publicKey)
        .appendMessage("sign:R", r);
    return GROUP.reduceWide(transcript.challengeBytes("sign:c", 64));
  }
}
